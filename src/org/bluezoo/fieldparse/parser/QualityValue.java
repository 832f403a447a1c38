/*
 * QualityValue.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * An element of an Accept-style list annotated with what is needed to
 * rank it: its quality, whether the quality was given explicitly, its
 * specificity and its position in the header.
 * @see <a href='https://www.rfc-editor.org/rfc/rfc9110#section-12.4.2'>RFC 9110</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class QualityValue<T> {

	/** Anything that reads as a decimal number. */
	private static final Pattern NUMBER = Pattern.compile("[0-9]*(\\.[0-9]*)?");

	/** The RFC 9110 qvalue grammar. */
	private static final Pattern QVALUE = Pattern.compile("0(\\.[0-9]{0,3})?|1(\\.0{0,3})?");

	/**
	 * Highest quality first; at equal quality an explicit maximum
	 * before an inferred one; then most specific first; then first
	 * seen first.
	 */
	static final Comparator<QualityValue<?>> ORDER = new Comparator<QualityValue<?>>() {
		@Override
		public int compare(QualityValue<?> a, QualityValue<?> b) {
			int c = Double.compare(b.quality, a.quality);
			if (c != 0) {
				return c;
			}
			if (a.explicit != b.explicit) {
				return a.explicit ? -1 : 1;
			}
			c = Integer.compare(b.specificity, a.specificity);
			if (c != 0) {
				return c;
			}
			return Integer.compare(a.position, b.position);
		}
	};

	final T value;
	final double quality;
	final boolean explicit;
	final int specificity;
	final int position;

	QualityValue(T value, double quality, boolean explicit, int specificity, int position) {
		this.value = value;
		this.quality = quality;
		this.explicit = explicit;
		this.specificity = specificity;
		this.position = position;
	}

	/**
	 * Sorts the annotated values and strips the annotations.
	 * @param values the annotated values
	 * @return the values in preference order
	 */
	static <T> List<T> sort(List<QualityValue<T>> values) {
		List<QualityValue<T>> sorted = new ArrayList<>(values);
		Collections.sort(sorted, ORDER);
		List<T> result = new ArrayList<>(sorted.size());
		for (QualityValue<T> qv : sorted) {
			result.add(qv.value);
		}
		return result;
	}

	/**
	 * Parses the value of a {@code q} parameter.
	 * In strict mode the numeral must follow the qvalue grammar. In
	 * lenient mode any number between 0 and 1 with at most three
	 * decimals is accepted and anything else counts as 0. Text that is
	 * not a number at all is malformed.
	 * @param text the parameter value
	 * @param strict whether to reject numerals outside the grammar
	 * @return the quality, or a failure
	 */
	static ParseResult<Double> parseQuality(String text, boolean strict) {
		String s = text.trim();
		if (!NUMBER.matcher(s).matches() || !hasDigit(s)) {
			return ParseResult.failure(ParseResult.Kind.MALFORMED_VALUE,
					SkippedElements.message("warn.invalid_quality", text));
		}
		if (QVALUE.matcher(s).matches()) {
			return ParseResult.success(Double.valueOf(s));
		}
		String message = SkippedElements.message("warn.quality_range", text);
		if (strict) {
			return ParseResult.failure(ParseResult.Kind.STRICT_VIOLATION, message);
		}
		double quality = Double.parseDouble(s);
		int dot = s.indexOf('.');
		int decimals = (dot < 0) ? 0 : s.length() - dot - 1;
		if (quality >= 0.0 && quality <= 1.0 && decimals <= 3) {
			return ParseResult.success(quality);
		}
		return ParseResult.success(0.0, Collections.singletonList(message));
	}

	private static boolean hasDigit(String s) {
		for (int i = 0; i < s.length(); i++) {
			if (Character.isDigit(s.charAt(i))) {
				return true;
			}
		}
		return false;
	}

	@Override
	public String toString() {
		return value + ";q=" + quality + (explicit ? "" : "(inferred)");
	}

}
