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

/**
 * Identifier, keyword or literal
 */
public class Token extends JSExpr
{
  private final String token;
  private final int precedence;

  public Token(String token)
  {
    this(token, PRIMARY_PRECEDENCE);
  }

  private Token(String token, int precedence)
  {
    this.token = token;
    this.precedence = precedence;
  }

  /**
   * A leading minus sign makes a numeric literal bind like a unary
   * expression
   * @param text formatted number
   */
  public static Token number(String text)
  {
    if (text.startsWith("-")) {
      return new Token(text, UNARY_PRECEDENCE);
    }
    return new Token(text);
  }

  @Override
  public int precedence()
  {
    return precedence;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    sb.append(token);
  }
}
