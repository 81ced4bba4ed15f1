/*-
 * #%L
 * Not HDF5
 * %%
 * Copyright (C) 2019 - 2025 Stephan Saalfeld
 * %%
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *
 * 1. Redistributions of source code must retain the above copyright notice,
 *    this list of conditions and the following disclaimer.
 * 2. Redistributions in binary form must reproduce the above copyright notice,
 *    this list of conditions and the following disclaimer in the documentation
 *    and/or other materials provided with the distribution.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
 * ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT HOLDERS OR CONTRIBUTORS BE
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE
 * POSSIBILITY OF SUCH DAMAGE.
 * #L%
 */
package org.janelia.saalfeldlab.n5.backend.dataset;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Human readable byte counts in decimal units.
 */
final class ByteSize {

	private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB", "PB", "EB"};

	private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

	private ByteSize() {}

	static String format(final long bytes) {

		if (bytes < 1000)
			return bytes + " B";

		/* the unit is chosen after rounding so that 999995 B is 1.00 MB and not 1000.00 KB */
		int unit = 0;
		BigDecimal value = BigDecimal.valueOf(bytes).setScale(2, RoundingMode.HALF_UP);
		while (value.compareTo(THOUSAND) >= 0 && unit < UNITS.length - 1) {
			++unit;
			value = BigDecimal.valueOf(bytes).movePointLeft(3 * unit).setScale(2, RoundingMode.HALF_UP);
		}
		return value.toPlainString() + " " + UNITS[unit];
	}
}
