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
package exm.quint.frontend;

import java.math.BigInteger;

import org.apache.commons.lang3.StringUtils;

import exm.quint.common.exceptions.QuintRuntimeError;

/**
 * Values of literal tokens
 */
public class Literals {

  /**
   * Parse an integer token: decimal or 0x-prefixed hexadecimal, with
   * optional '_' digit separators
   * @param token
   * @return the value
   */
  public static BigInteger parseIntToken(String token) {
    String digits = StringUtils.remove(token, '_');
    if (digits.startsWith("0x") || digits.startsWith("0X")) {
      return parseIntLiteral(digits.substring(2), 16, "hexadecimal");
    }
    return parseIntLiteral(digits, 10, "decimal");
  }

  private static BigInteger parseIntLiteral(String number, int base,
                                            String literalType) {
    try {
      return new BigInteger(number, base);
    } catch (NumberFormatException e) {
      // The parser only hands over well-formed tokens
      throw new QuintRuntimeError("Invalid " + literalType +
                                  " literal: " + number);
    }
  }

  public static boolean parseBoolToken(String token) {
    return token.equals("true");
  }

  /**
   * @param token string token including the double quotes
   * @return the contents
   */
  public static String extractStringLit(String token) {
    return StringUtils.unwrap(token, '"');
  }
}
