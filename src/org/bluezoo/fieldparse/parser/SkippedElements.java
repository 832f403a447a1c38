/*
 * SkippedElements.java
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

import org.bluezoo.fieldparse.ParseResult;

import java.text.MessageFormat;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records the elements that a lenient parser drops.
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class SkippedElements {

	static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.fieldparse.parser.L10N");

	private SkippedElements() {
		// Static utility class
	}

	/**
	 * Adds a warning for a skipped element and logs it.
	 * @param logger the logger of the calling parser
	 * @param headerName the header being parsed
	 * @param element the text of the skipped element
	 * @param reason why the element was skipped
	 * @param warnings the warnings to append to
	 */
	static void record(Logger logger, String headerName, String element, String reason, List<String> warnings) {
		String message = MessageFormat.format(L10N.getString("warn.skipped"), headerName, element, reason);
		warnings.add(message);
		if (logger.isLoggable(Level.FINE)) {
			logger.fine(message);
		}
	}

	/**
	 * Promotes the failure of a single element to a strict-mode
	 * violation of the whole header.
	 * @param headerName the header being parsed
	 * @param element the text of the element
	 * @param failed the failed element result
	 * @return the failure for the header
	 */
	static <T> ParseResult<T> strictFailure(String headerName, String element, ParseResult<?> failed) {
		if (failed.getFailureKind() == ParseResult.Kind.STRICT_VIOLATION) {
			return ParseResult.failure(ParseResult.Kind.STRICT_VIOLATION, failed.getFailureMessage());
		}
		return ParseResult.failure(ParseResult.Kind.STRICT_VIOLATION,
				message("warn.skipped", headerName, element, failed.getFailureMessage()));
	}

	/**
	 * Formats a localized message.
	 * @param key the message key
	 * @param args the message arguments
	 * @return the message
	 */
	static String message(String key, Object... args) {
		String pattern = L10N.getString(key);
		return (args.length == 0) ? pattern : MessageFormat.format(pattern, args);
	}

}
