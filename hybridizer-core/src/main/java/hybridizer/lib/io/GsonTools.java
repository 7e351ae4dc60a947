/*-
 * #%L
 * This file is part of Hybridizer.
 * %%
 * Copyright (C) 2026 Hybridizer developers
 * %%
 * Hybridizer is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * Hybridizer is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with Hybridizer.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package hybridizer.lib.io;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Helper class providing Gson instances configured consistently for reading and 
 * writing parameter files.
 * 
 * @author Hybridizer developers
 *
 */
public class GsonTools {
	
	private static final Logger logger = LoggerFactory.getLogger(GsonTools.class);
	
	private static final GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient();
	
	private GsonTools() {
		throw new AssertionError();
	}
	
	/**
	 * Get a default Gson instance.
	 * @return
	 */
	public static Gson getInstance() {
		return builder.create();
	}
	
	/**
	 * Read an object from a JSON file.
	 * 
	 * @param <T>
	 * @param path the file to read
	 * @param cls the class of the object
	 * @return the object, or null if the file is empty
	 * @throws IOException if the file cannot be read or does not contain valid JSON for the class
	 */
	public static <T> T readJson(Path path, Class<T> cls) throws IOException {
		logger.debug("Reading {} from {}", cls.getSimpleName(), path);
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return getInstance().fromJson(reader, cls);
		} catch (JsonParseException e) {
			throw new IOException("Unable to parse " + path + ": " + e.getLocalizedMessage(), e);
		}
	}

}
