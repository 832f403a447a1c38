/*
 * ScanOptions.java
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

/**
 * Flags controlling how {@link ParameterParser} scans a parameter list.
 * Instances are immutable; the {@code with} methods return modified
 * copies.
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ScanOptions {

	/**
	 * Quote aware, values required, everything else off.
	 */
	public static final ScanOptions DEFAULT = new ScanOptions(true, false, false, false, true, false);

	/**
	 * Options for Content-Type and Accept: RFC 2045 comments are
	 * discarded and whitespace around '=' is tolerated.
	 */
	public static final ScanOptions CONTENT_TYPE = new ScanOptions(true, true, false, true, true, false);

	/**
	 * Options for Link: whitespace around '=' is tolerated (RFC 8288
	 * erratum 5318) and valueless parameters are allowed.
	 */
	public static final ScanOptions LINK = new ScanOptions(true, false, false, true, false, false);

	/**
	 * Options for Forwarded, whose pairs must be written exactly.
	 */
	public static final ScanOptions FORWARDED = new ScanOptions(true, false, false, false, true, false);

	private final boolean quoteAware;
	private final boolean commentAware;
	private final boolean lowercaseValues;
	private final boolean tolerateBadWhitespace;
	private final boolean requireValues;
	private final boolean strict;

	private ScanOptions(boolean quoteAware, boolean commentAware, boolean lowercaseValues,
			boolean tolerateBadWhitespace, boolean requireValues, boolean strict) {
		this.quoteAware = quoteAware;
		this.commentAware = commentAware;
		this.lowercaseValues = lowercaseValues;
		this.tolerateBadWhitespace = tolerateBadWhitespace;
		this.requireValues = requireValues;
		this.strict = strict;
	}

	/**
	 * Whether double quotes introduce quoted-string values.
	 * When false a double quote is an ordinary value character.
	 * @return the flag
	 */
	public boolean isQuoteAware() {
		return quoteAware;
	}

	/**
	 * Whether parenthesized comments outside quoted-strings are
	 * discarded.
	 * @return the flag
	 */
	public boolean isCommentAware() {
		return commentAware;
	}

	/**
	 * Whether values are folded to lower case.
	 * @return the flag
	 */
	public boolean isLowercaseValues() {
		return lowercaseValues;
	}

	/**
	 * Whether whitespace before or after '=' is accepted.
	 * @return the flag
	 */
	public boolean isTolerateBadWhitespace() {
		return tolerateBadWhitespace;
	}

	/**
	 * Whether every parameter must have a value. When false a
	 * parameter without '=' is given an empty value.
	 * @return the flag
	 */
	public boolean isRequireValues() {
		return requireValues;
	}

	/**
	 * Whether an unparseable parameter fails the scan instead of being
	 * skipped.
	 * @return the flag
	 */
	public boolean isStrict() {
		return strict;
	}

	/**
	 * Returns a copy with quoted-string handling switched on or off.
	 * @param quoteAware whether double quotes introduce quoted-strings
	 * @return the adjusted options
	 */
	public ScanOptions withQuoteAware(boolean quoteAware) {
		return new ScanOptions(quoteAware, commentAware, lowercaseValues, tolerateBadWhitespace, requireValues, strict);
	}

	/**
	 * Returns a copy that discards or keeps parenthesized comments.
	 * @param commentAware whether comments are discarded
	 * @return the adjusted options
	 */
	public ScanOptions withCommentAware(boolean commentAware) {
		return new ScanOptions(quoteAware, commentAware, lowercaseValues, tolerateBadWhitespace, requireValues, strict);
	}

	/**
	 * Returns a copy that folds or preserves value case.
	 * @param lowercaseValues whether values are folded to lower case
	 * @return the adjusted options
	 */
	public ScanOptions withLowercaseValues(boolean lowercaseValues) {
		return new ScanOptions(quoteAware, commentAware, lowercaseValues, tolerateBadWhitespace, requireValues, strict);
	}

	/**
	 * Returns a copy that accepts or rejects whitespace around '='.
	 * @param tolerateBadWhitespace whether whitespace around '=' is accepted
	 * @return the adjusted options
	 */
	public ScanOptions withTolerateBadWhitespace(boolean tolerateBadWhitespace) {
		return new ScanOptions(quoteAware, commentAware, lowercaseValues, tolerateBadWhitespace, requireValues, strict);
	}

	/**
	 * Returns a copy that requires or waives parameter values.
	 * @param requireValues whether every parameter needs a value
	 * @return the adjusted options
	 */
	public ScanOptions withRequireValues(boolean requireValues) {
		return new ScanOptions(quoteAware, commentAware, lowercaseValues, tolerateBadWhitespace, requireValues, strict);
	}

	/**
	 * Returns these options in strict or lenient mode.
	 * @param strict whether unparseable parameters fail the scan
	 * @return the adjusted options
	 */
	public ScanOptions withStrict(boolean strict) {
		if (strict == this.strict) {
			return this;
		}
		return new ScanOptions(quoteAware, commentAware, lowercaseValues, tolerateBadWhitespace, requireValues, strict);
	}

	@Override
	public boolean equals(Object other) {
		if (!(other instanceof ScanOptions)) {
			return false;
		}
		ScanOptions o = (ScanOptions) other;
		return quoteAware == o.quoteAware && commentAware == o.commentAware &&
			   lowercaseValues == o.lowercaseValues &&
			   tolerateBadWhitespace == o.tolerateBadWhitespace &&
			   requireValues == o.requireValues && strict == o.strict;
	}

	@Override
	public int hashCode() {
		int h = 0;
		for (boolean flag : new boolean[] { quoteAware, commentAware, lowercaseValues, tolerateBadWhitespace, requireValues, strict }) {
			h = (h << 1) | (flag ? 1 : 0);
		}
		return h;
	}

	@Override
	public String toString() {
		return "ScanOptions[quoteAware=" + quoteAware +
			", commentAware=" + commentAware +
			", lowercaseValues=" + lowercaseValues +
			", tolerateBadWhitespace=" + tolerateBadWhitespace +
			", requireValues=" + requireValues +
			", strict=" + strict + "]";
	}

}
