/*
 * NegotiationResult.java
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

package org.bluezoo.fieldparse.negotiation;

import org.bluezoo.fieldparse.ContentType;

/**
 * The outcome of content negotiation: the available content type that
 * was selected and the requested media range it satisfied.
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class NegotiationResult {

	private final ContentType requested;
	private final ContentType selected;

	NegotiationResult(ContentType requested, ContentType selected) {
		this.requested = requested;
		this.selected = selected;
	}

	/**
	 * Returns the requested media range that matched. When the default
	 * was used this is the default itself.
	 * @return the requested media range
	 */
	public ContentType getRequested() {
		return requested;
	}

	/**
	 * Returns the selected content type, to be used as the
	 * Content-Type of the response.
	 * @return the selected content type
	 */
	public ContentType getSelected() {
		return selected;
	}

	@Override
	public boolean equals(Object other) {
		if (!(other instanceof NegotiationResult)) {
			return false;
		}
		NegotiationResult o = (NegotiationResult) other;
		return requested.equals(o.requested) && selected.equals(o.selected);
	}

	@Override
	public int hashCode() {
		return requested.hashCode() * 31 + selected.hashCode();
	}

	@Override
	public String toString() {
		return selected + " (" + requested.toHeaderValue() + ")";
	}

}
