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
package org.janelia.saalfeldlab.n5.backend;

import java.lang.reflect.Type;

import org.janelia.saalfeldlab.n5.DataType;

import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

/**
 * Element types of datasets, written as numpy array interface type strings
 * as defined at
 * https://docs.scipy.org/doc/numpy/reference/arrays.interface.html
 *
 * Only the byte width matters for chunk and buffer arithmetic.  Object arrays
 * ("|O") are only ever configured when all their elements are text and are
 * then stored as variable length UTF-8 strings, so their width is that of
 * one reference.
 */
public class DType {

	/* width of one element of an object array, a reference */
	public static final int OBJECT_REFERENCE_BYTES = 8;

	public enum Primitive {

		BIT('t'),
		BOOLEAN('b'),
		INT('i'),
		UNSIGNED_INT('u'),
		FLOAT('f'),
		COMPLEX_FLOAT('c'),
		TIMEDELTA('m'),
		DATETIME('M'),
		OBJECT('O'),
		STRING('S'),
		UNICODE('U'),
		OTHER('V');

		private final char code;

		Primitive(final char code) {

			this.code = code;
		}

		public static Primitive fromCode(final char code) {

			for (final Primitive value : values())
				if (value.code == code)
					return value;
			return null;
		}
	}

	protected final String typestr;
	protected final Primitive primitive;

	/* number of bytes per scalar except for BIT where it is the number of bits */
	protected final int nBytes;
	protected final int nBits;

	public DType(final String typestr) {

		if (typestr == null || typestr.length() < 2)
			throw new IllegalArgumentException("Invalid type string '" + typestr + "'.");

		this.typestr = typestr;

		primitive = Primitive.fromCode(typestr.charAt(1));
		if (primitive == null)
			throw new IllegalArgumentException("Unknown type code '" + typestr.charAt(1) + "' in '" + typestr + "'.");

		final int nB;
		if (primitive == Primitive.OBJECT)
			nB = 0;
		else {
			try {
				nB = Integer.parseInt(typestr.substring(2));
			} catch (final NumberFormatException e) {
				throw new IllegalArgumentException("Missing item size in type string '" + typestr + "'.", e);
			}
		}

		switch (primitive) {
		case BIT:
			nBytes = 0;
			nBits = nB;
			break;
		case OBJECT:
			nBytes = OBJECT_REFERENCE_BYTES;
			nBits = 0;
			break;
		case UNICODE:
			// numpy counts UCS4 characters
			nBytes = 4 * nB;
			nBits = 0;
			break;
		default:
			nBytes = nB;
			nBits = 0;
		}
	}

	/**
	 * The closest n5 {@link DataType} or {@code null} if there is none.
	 *
	 * @return the data type
	 */
	public DataType getDataType() {

		switch (primitive) {
		case INT:
			switch (nBytes) {
			case 1:
				return DataType.INT8;
			case 2:
				return DataType.INT16;
			case 4:
				return DataType.INT32;
			case 8:
				return DataType.INT64;
			default:
				return null;
			}
		case UNSIGNED_INT:
			switch (nBytes) {
			case 1:
				return DataType.UINT8;
			case 2:
				return DataType.UINT16;
			case 4:
				return DataType.UINT32;
			case 8:
				return DataType.UINT64;
			default:
				return null;
			}
		case BOOLEAN:
			return DataType.UINT8;
		case FLOAT:
			switch (nBytes) {
			case 4:
				return DataType.FLOAT32;
			case 8:
				return DataType.FLOAT64;
			default:
				return null;
			}
		case OBJECT:
			return DataType.STRING;
		default:
			return null;
		}
	}

	public boolean isObject() {

		return primitive == Primitive.OBJECT;
	}

	/**
	 * The width of one element in bytes for size estimates, bit types are
	 * rounded up to whole bytes.
	 *
	 * @return item size in bytes
	 */
	public int getItemSize() {

		if (primitive == Primitive.BIT)
			return (nBits + 7) / 8;
		return nBytes;
	}

	@Override
	public boolean equals(final Object other) {

		if (this == other)
			return true;
		if (!(other instanceof DType))
			return false;
		return typestr.equals(((DType)other).typestr);
	}

	@Override
	public int hashCode() {

		return typestr.hashCode();
	}

	@Override
	public String toString() {

		return typestr;
	}

	public static class JsonAdapter implements JsonDeserializer<DType>, JsonSerializer<DType> {

		@Override
		public DType deserialize(
				final JsonElement json,
				final Type typeOfT,
				final JsonDeserializationContext context) throws JsonParseException {

			try {
				return new DType(json.getAsString());
			} catch (final IllegalArgumentException e) {
				throw new JsonParseException(e);
			}
		}

		@Override
		public JsonElement serialize(
				final DType src,
				final Type typeOfSrc,
				final JsonSerializationContext context) {

			return new JsonPrimitive(src.toString());
		}
	}
}
