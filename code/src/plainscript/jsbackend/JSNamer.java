/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package plainscript.jsbackend;

import java.util.IdentityHashMap;
import java.util.Map;

import plainscript.frontend.Declaration;

/**
 * Gives each declaration a distinct JavaScript name: the source name
 * with a numeric suffix, numbered in order of first use.  Shadowed
 * names therefore never clash in the output.
 */
public class JSNamer {
  private final Map<Declaration, String> names =
                          new IdentityHashMap<Declaration, String>();
  private int counter = 0;

  public String name(Declaration decl) {
    String name = names.get(decl);
    if (name == null) {
      counter++;
      name = decl.getName() + "_" + counter;
      names.put(decl, name);
    }
    return name;
  }

  /**
   * @return number of names handed out
   */
  public int size() {
    return counter;
  }
}
