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

package plainscript.jsbackend.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Statements rendered one after the other
 */
public class Sequence extends JSTree
{
  private final List<JSTree> members = new ArrayList<JSTree>();

  public void add(JSTree tree)
  {
    members.add(tree);
  }

  /**
   * Append at end of current sequence
   * @param seq
   */
  public void append(Sequence seq)
  {
    members.addAll(seq.members);
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    for (JSTree member : members)
    {
      prepareChild(member, indentation);
      member.appendTo(sb);
    }
  }
}
