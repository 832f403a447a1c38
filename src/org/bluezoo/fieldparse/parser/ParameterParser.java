/*
 * ParameterParser.java
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

package org.bluezoo.fieldparse.parser;

import org.bluezoo.fieldparse.MalformedValueException;
import org.bluezoo.fieldparse.Parameter;
import org.bluezoo.fieldparse.ParseResult;
import org.bluezoo.fieldparse.Tokens;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Scanner for semicolon-delimited parameter lists such as
 * {@code ; charset="utf-8"; format=flowed}.
 * <p>
 * The scan is a single left-to-right pass over the input driven by an
 * explicit state. Values may be bare tokens or quoted-strings with
 * backslash escapes; comments are discarded when the options ask for
 * it. A parameter that cannot be understood is skipped with a warning,
 * or fails the scan in strict mode. An unterminated quoted-string or
 * comment, or a missing '=' where values are required, always fails.
 * @see <a href='https://www.rfc-editor.org/rfc/rfc9110#section-5.6.6'>RFC 9110</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ParameterParser {

	private static final Logger LOGGER = Logger.getLogger(ParameterParser.class.getName());

	static final String HEADER_NAME = "Parameters";

	private enum State {
		OUTSIDE,
		NAME,
		BEFORE_VALUE,
		VALUE_BARE,
		VALUE_QUOTED,
		AFTER_QUOTED,
		COMMENT
	}

	/**
	 * Scan state for one pass over the input. Per-parameter fields are
	 * reset at the start of each segment.
	 */
	private static final class ScanState {

		final String input;
		final ScanOptions options;
		final String headerName;
		final List<Parameter> parameters = new ArrayList<>();
		final List<String> warnings = new ArrayList<>();

		State state = State.OUTSIDE;
		State resume;
		int commentDepth;

		int segmentStart;
		final StringBuilder name = new StringBuilder();
		final StringBuilder value = new StringBuilder();
		boolean hasEquals;
		boolean quoted;
		boolean pendingWhitespace;
		String problem;

		ScanState(String headerName, String input, ScanOptions options) {
			this.headerName = headerName;
			this.input = input;
			this.options = options;
		}

		void startSegment(int pos) {
			segmentStart = pos;
			name.setLength(0);
			value.setLength(0);
			hasEquals = false;
			quoted = false;
			pendingWhitespace = false;
			problem = null;
			state = State.NAME;
		}

		void problem(String key) {
			if (problem == null) {
				problem = SkippedElements.message(key);
			}
		}

		void enterComment(State from) {
			resume = from;
			commentDepth = 1;
			state = State.COMMENT;
		}

		/**
		 * Completes the current segment.
		 * @param end the index just past the segment
		 * @return a failure, or null to continue scanning
		 */
		ParseResult<List<Parameter>> finish(int end) {
			state = State.OUTSIDE;
			String segment = input.substring(segmentStart, end).trim();
			String n = name.toString();
			if (!hasEquals) {
				if (options.isRequireValues()) {
					return ParseResult.failure(ParseResult.Kind.MALFORMED_PARAMETER_LIST,
							SkippedElements.message("err.missing_equals", n));
				}
			}
			if (problem == null) {
				if (!Tokens.isToken(n)) {
					problem("warn.invalid_name");
				} else if (hasEquals && !quoted && value.length() == 0) {
					problem("warn.empty_value");
				}
			}
			if (problem != null) {
				if (options.isStrict()) {
					return ParseResult.failure(ParseResult.Kind.STRICT_VIOLATION,
							SkippedElements.message("warn.skipped", headerName, segment, problem));
				}
				SkippedElements.record(LOGGER, headerName, segment, problem, warnings);
				return null;
			}
			String v = value.toString();
			if (options.isLowercaseValues()) {
				v = v.toLowerCase(Locale.ROOT);
			}
			parameters.add(new Parameter(n.toLowerCase(Locale.ROOT), v));
			return null;
		}

	}

	private ParameterParser() {
		// Static utility class
	}

	/**
	 * Parses a parameter list.
	 * @param input the parameter list, optionally starting with ';'
	 * @param options the scan options
	 * @return the parameters in order of appearance
	 * @exception MalformedValueException if the list cannot be scanned,
	 * or in strict mode if a parameter cannot be understood
	 */
	public static List<Parameter> parse(String input, ScanOptions options) throws MalformedValueException {
		return scan(HEADER_NAME, input, options).getValueOrThrow(HEADER_NAME, input);
	}

	/**
	 * Scans a parameter list without throwing.
	 * @param input the parameter list, optionally starting with ';'
	 * @param options the scan options
	 * @return the parameters together with a warning for every
	 * parameter that was skipped, or a failure
	 */
	public static ParseResult<List<Parameter>> scan(String input, ScanOptions options) {
		return scan(HEADER_NAME, input, options);
	}

	static ParseResult<List<Parameter>> scan(String headerName, String input, ScanOptions options) {
		if (input == null || options == null) {
			throw new NullPointerException("input and options must not be null");
		}
		ScanState s = new ScanState(headerName, input, options);
		int len = input.length();
		int pos = 0;
		while (pos < len) {
			char c = input.charAt(pos);
			boolean ws = Tokens.isWhitespace(c);
			boolean comment = c == '(' && options.isCommentAware();
			boolean quote = c == '"' && options.isQuoteAware();
			ParseResult<List<Parameter>> failure = null;
			switch (s.state) {
				case OUTSIDE:
					if (comment) {
						s.enterComment(State.OUTSIDE);
					} else if (!ws && c != ';') {
						s.startSegment(pos);
						continue; // reprocess as part of the name
					}
					break;
				case NAME:
					if (c == ';') {
						failure = s.finish(pos);
					} else if (c == '=') {
						if (s.pendingWhitespace && !options.isTolerateBadWhitespace()) {
							s.problem("warn.bad_whitespace");
						}
						s.pendingWhitespace = false;
						s.hasEquals = true;
						s.state = State.BEFORE_VALUE;
					} else if (ws) {
						s.pendingWhitespace = s.name.length() > 0;
					} else if (comment) {
						s.enterComment(State.NAME);
					} else {
						if (s.pendingWhitespace) {
							s.problem("warn.invalid_name");
							s.pendingWhitespace = false;
						}
						s.name.append(c);
					}
					break;
				case BEFORE_VALUE:
					if (c == ';') {
						failure = s.finish(pos);
					} else if (ws) {
						if (!options.isTolerateBadWhitespace()) {
							s.problem("warn.bad_whitespace");
						}
					} else if (quote) {
						s.quoted = true;
						s.state = State.VALUE_QUOTED;
					} else if (comment) {
						s.enterComment(State.BEFORE_VALUE);
					} else {
						s.value.append(c);
						s.state = State.VALUE_BARE;
					}
					break;
				case VALUE_BARE:
					if (c == ';') {
						failure = s.finish(pos);
					} else if (ws) {
						s.pendingWhitespace = true;
					} else if (comment) {
						s.enterComment(State.VALUE_BARE);
					} else if (quote) {
						s.problem("warn.quote_in_value");
						s.state = State.VALUE_QUOTED;
					} else {
						if (s.pendingWhitespace) {
							s.problem("warn.whitespace_in_value");
							s.pendingWhitespace = false;
						}
						s.value.append(c);
					}
					break;
				case VALUE_QUOTED:
					if (c == '\\' && pos + 1 < len) {
						s.value.append(input.charAt(++pos));
					} else if (c == '"') {
						s.state = State.AFTER_QUOTED;
					} else {
						s.value.append(c);
					}
					break;
				case AFTER_QUOTED:
					if (c == ';') {
						failure = s.finish(pos);
					} else if (comment) {
						s.enterComment(State.AFTER_QUOTED);
					} else if (!ws) {
						s.problem("warn.junk_after_quote");
					}
					break;
				case COMMENT:
					if (c == '\\') {
						pos++;
					} else if (c == '(') {
						s.commentDepth++;
					} else if (c == ')') {
						if (--s.commentDepth == 0) {
							s.state = s.resume;
						}
					}
					break;
				default:
					throw new IllegalStateException(s.state.name());
			}
			if (failure != null) {
				return failure;
			}
			pos++;
		}
		switch (s.state) {
			case VALUE_QUOTED:
				return ParseResult.failure(ParseResult.Kind.MALFORMED_PARAMETER_LIST,
						SkippedElements.message("err.unterminated_quote"));
			case COMMENT:
				return ParseResult.failure(ParseResult.Kind.MALFORMED_PARAMETER_LIST,
						SkippedElements.message("err.unterminated_comment"));
			case OUTSIDE:
				break;
			default:
				ParseResult<List<Parameter>> failure = s.finish(len);
				if (failure != null) {
					return failure;
				}
		}
		return ParseResult.success(Collections.unmodifiableList(s.parameters), s.warnings);
	}

	/**
	 * Finds the next delimiter that is outside quoted-strings and, when
	 * the options are comment aware, outside comments.
	 * @param s the string to search
	 * @param delimiter the delimiter
	 * @param from the index to start from
	 * @param options the scan options
	 * @return the index of the delimiter, or -1 if there is none
	 */
	static int indexOfDelimiter(String s, char delimiter, int from, ScanOptions options) {
		boolean quoted = false;
		int depth = 0;
		for (int i = from; i < s.length(); i++) {
			char c = s.charAt(i);
			if (quoted) {
				if (c == '\\') {
					i++;
				} else if (c == '"') {
					quoted = false;
				}
			} else if (depth > 0) {
				if (c == '\\') {
					i++;
				} else if (c == '(') {
					depth++;
				} else if (c == ')') {
					depth--;
				}
			} else if (c == '"' && options.isQuoteAware()) {
				quoted = true;
			} else if (c == '(' && options.isCommentAware()) {
				depth = 1;
			} else if (c == delimiter) {
				return i;
			}
		}
		return -1;
	}

}
