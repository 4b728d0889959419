package io.vena.strata.util;

import io.vena.strata.exceptions.DeserializationException;
import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * zlib-format compression for {@link io.vena.strata.metadata.FieldType#COMPRESSED_TEXT COMPRESSED_TEXT} fields.
 */
public final class Compression {
	/**
	 * Level used for values headed to the database.
	 */
	public static final int WRITE_LEVEL = 5;

	public static byte[] deflate(String text) {
		return deflate(text, Deflater.DEFAULT_COMPRESSION);
	}

	public static byte[] deflate(String text, int level) {
		Deflater deflater = new Deflater(level);
		try {
			deflater.setInput(text.getBytes(UTF_8));
			deflater.finish();
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			byte[] buffer = new byte[BUFFER_SIZE];
			while (!deflater.finished()) {
				int length = deflater.deflate(buffer);
				out.write(buffer, 0, length);
			}
			return out.toByteArray();
		} finally {
			deflater.end();
		}
	}

	/**
	 * @throws DeserializationException if <code>compressed</code> is not valid zlib data
	 */
	public static String inflate(byte[] compressed) {
		Inflater inflater = new Inflater();
		try {
			inflater.setInput(compressed);
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			byte[] buffer = new byte[BUFFER_SIZE];
			while (!inflater.finished()) {
				int length = inflater.inflate(buffer);
				if (length == 0 && !inflater.finished() && (inflater.needsInput() || inflater.needsDictionary())) {
					throw new DeserializationException("Truncated compressed value (" + compressed.length + " bytes)");
				}
				out.write(buffer, 0, length);
			}
			return out.toString(UTF_8);
		} catch (DataFormatException e) {
			throw new DeserializationException("Invalid compressed value", e);
		} finally {
			inflater.end();
		}
	}

	private static final int BUFFER_SIZE = 4096;
}
