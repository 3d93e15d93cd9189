/*
 * Copyright Travolo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.travolo.online;

import java.util.List;

import org.apache.mahout.cf.taste.common.TasteException;

import net.travolo.online.model.CatalogItem;

/**
 * Supplies the full list of catalog items to recommend from.
 */
public interface CatalogProvider {

  /**
   * @return all catalog items, in a stable order; possibly empty
   * @throws TasteException if the catalog can't be read
   */
  List<CatalogItem> getCatalog() throws TasteException;

}
