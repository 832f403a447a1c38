/*
 * Tokens.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of fieldparse, a library for parsing structured
 * HTTP and MIME header field values.
 *
 * fieldparse is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * fieldparse is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with fieldparse.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.fieldparse;

/**
 * Utility methods for recognising and producing the lexical elements
 * shared by structured header field values: tokens, quoted-strings and
 * comments.
 * @see <a href='https://www.rfc-editor.org/rfc/rfc9110#section-5.6'>RFC 9110</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Tokens {

	private Tokens() {
		// Static utility class
	}

	/**
	 * Checks if a string is a valid RFC 9110 token.
	 * A token is 1 or more characters from the set:
	 * {@code !#$%&amp;'*+-.^_`|~0-9A-Za-z}
	 * @param s the string to check
	 * @return true if the string is a valid token
	 * @see <a href='https://www.rfc-editor.org/rfc/rfc9110#section-5.6.2'>RFC 9110</a>
	 */
	public static boolean isToken(String s) {
		if (s == null || s.isEmpty()) {
			return false;
		}
		for (int i = 0; i < s.length(); i++) {
			if (!isTokenChar(s.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Checks if a character is valid in an RFC 9110 token (tchar).
	 * @param c the character to check
	 * @return true if the character is valid in a token
	 */
	public static boolean isTokenChar(char c) {
		return (c >= '0' && c <= '9') ||
			   (c >= 'A' && c <= 'Z') ||
			   (c >= 'a' && c <= 'z') ||
			   c == '!' || c == '#' || c == '$' || c == '%' || c == '&' ||
			   c == '\'' || c == '*' || c == '+' || c == '-' || c == '.' ||
			   c == '^' || c == '_' || c == '`' || c == '|' || c == '~';
	}

	/**
	 * Checks for optional whitespace (space or horizontal tab).
	 * @param c the character to check
	 * @return true if the character is SP or HTAB
	 */
	public static boolean isWhitespace(char c) {
		return c == ' ' || c == '\t';
	}

	/**
	 * Returns the value unchanged if it is a token, otherwise as a
	 * quoted-string.
	 * @param value the value to format
	 * @return the value suitable for use as a parameter value
	 */
	public static String quoteIfNeeded(String value) {
		return isToken(value) ? value : quote(value);
	}

	/**
	 * Formats a value as a quoted-string.
	 * Backslash and double-quote are escaped.
	 * @param value the value to quote
	 * @return the quoted-string, including the surrounding quotes
	 */
	public static String quote(String value) {
		StringBuilder sb = new StringBuilder(value.length() + 8);
		sb.append('"');
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (c == '\\' || c == '"') {
				sb.append('\\');
			}
			sb.append(c);
		}
		sb.append('"');
		return sb.toString();
	}

	/**
	 * Removes one level of quoting from a value that is entirely a
	 * quoted-string, resolving quoted-pairs. Values that are not fully
	 * quoted are returned unchanged.
	 * @param value the value to unquote
	 * @return the unquoted value
	 */
	public static String unquote(String value) {
		int len = value.length();
		if (len < 2 || value.charAt(0) != '"' || value.charAt(len - 1) != '"') {
			return value;
		}
		StringBuilder sb = new StringBuilder(len);
		for (int i = 1; i < len - 1; i++) {
			char c = value.charAt(i);
			if (c == '\\' && i + 1 < len - 1) {
				c = value.charAt(++i);
			}
			sb.append(c);
		}
		return sb.toString();
	}

	/**
	 * Finds the next occurrence of a delimiter that is not inside a
	 * quoted-string.
	 * @param s the string to search
	 * @param delimiter the delimiter character
	 * @param from the index to start searching from
	 * @return the index of the delimiter, or -1 if there is none
	 */
	public static int indexOfUnquoted(String s, char delimiter, int from) {
		boolean quoted = false;
		for (int i = from; i < s.length(); i++) {
			char c = s.charAt(i);
			if (quoted) {
				if (c == '\\') {
					i++;
				} else if (c == '"') {
					quoted = false;
				}
			} else if (c == '"') {
				quoted = true;
			} else if (c == delimiter) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Removes RFC 2045 comments (parenthesized, possibly nested) that
	 * appear outside quoted-strings.
	 * @param s the string to clean
	 * @return the string without comments, or null if a comment or
	 * quoted-string is not terminated
	 */
	public static String stripComments(String s) {
		if (s.indexOf('(') < 0) {
			return s;
		}
		StringBuilder sb = new StringBuilder(s.length());
		int depth = 0;
		boolean quoted = false;
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (depth > 0) {
				if (c == '\\') {
					i++;
				} else if (c == '(') {
					depth++;
				} else if (c == ')') {
					depth--;
				}
			} else if (quoted) {
				sb.append(c);
				if (c == '\\' && i + 1 < s.length()) {
					sb.append(s.charAt(++i));
				} else if (c == '"') {
					quoted = false;
				}
			} else if (c == '(') {
				depth = 1;
			} else {
				if (c == '"') {
					quoted = true;
				}
				sb.append(c);
			}
		}
		return (depth > 0 || quoted) ? null : sb.toString();
	}

}
