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

import org.apache.commons.lang3.StringUtils;

/**
 * Abstract JavaScript tree node.  Renders itself as text, tracking the
 * indentation it is rendered at.
 */
public abstract class JSTree
{
  public static final int DEFAULT_INDENT_WIDTH = 2;

  int indentation = 0;
  int indentWidth = DEFAULT_INDENT_WIDTH;

  public abstract void appendTo(StringBuilder sb);

  /**
   * Append the tree to the StringBuilder inside
   * curly braces.
   * @param sb
   */
  public void appendToAsBlock(StringBuilder sb) {
    sb.append("{\n");
    increaseIndent();
    appendTo(sb);
    decreaseIndent();
    indent(sb);
    sb.append("}");
  }

  public void indent(StringBuilder sb)
  {
    sb.append(StringUtils.repeat(' ', indentation));
  }

  public void setIndentation(int i)
  {
    indentation = i;
  }

  public void setIndentWidth(int width)
  {
    indentWidth = width;
  }

  public void increaseIndent()
  {
    indentation += indentWidth;
  }

  public void decreaseIndent()
  {
    indentation -= indentWidth;
  }

  /**
   * Lay out a nested tree at the given indentation, with the same
   * indent width as this one
   */
  void prepareChild(JSTree child, int childIndentation)
  {
    child.setIndentWidth(indentWidth);
    child.setIndentation(childIndentation);
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder(2048);
    appendTo(sb);
    return sb.toString();
  }
}
