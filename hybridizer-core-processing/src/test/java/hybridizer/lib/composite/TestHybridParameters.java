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

package hybridizer.lib.composite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import hybridizer.lib.io.GsonTools;

@SuppressWarnings("javadoc")
public class TestHybridParameters {
	
	@TempDir
	Path tempDir;
	
	@Test
	public void test_defaults() {
		var params = HybridParameters.getDefault();
		assertEquals(4.5, params.getLowPassSigma());
		assertEquals(0.545, params.getSharpenAmountB());
		assertEquals(0.0, params.getSharpenAmountC());
		assertEquals(params.getLowPassSigma(), params.getHighPassSigma());
	}
	
	@Test
	public void test_builder() {
		var params = HybridParameters.getDefault().toBuilder()
				.lowPassSigma(2.0)
				.sharpenAmountB(1.5)
				.build();
		assertEquals(2.0, params.getLowPassSigma());
		assertEquals(2.0, params.getHighPassSigma());
		assertEquals(1.5, params.getSharpenAmountB());
		
		var params2 = params.toBuilder().highPassSigma(3.0).build();
		assertEquals(2.0, params2.getLowPassSigma());
		assertEquals(3.0, params2.getHighPassSigma());
		assertNotEquals(params, params2);
		assertEquals(params2, params2.toBuilder().build());
		assertEquals(params2.hashCode(), params2.toBuilder().build().hashCode());
	}
	
	@Test
	public void test_invalidValues() {
		var builder = HybridParameters.getDefault().toBuilder();
		assertThrows(IllegalArgumentException.class, () -> builder.lowPassSigma(-1));
		assertThrows(IllegalArgumentException.class, () -> builder.lowPassSigma(Double.NaN));
		assertThrows(IllegalArgumentException.class, () -> builder.highPassSigma(Double.POSITIVE_INFINITY));
		assertThrows(IllegalArgumentException.class, () -> builder.sharpenAmountB(Double.NaN));
		assertThrows(IllegalArgumentException.class, () -> builder.sharpenAmountC(Double.NEGATIVE_INFINITY));
		// Negative sharpen amounts are permitted
		assertEquals(-1.0, builder.sharpenAmountC(-1.0).build().getSharpenAmountC());
	}
	
	@Test
	public void test_readJson() throws IOException {
		var path = tempDir.resolve("params.json");
		Files.writeString(path, "{\"lowPassSigma\": 3.0, \"sharpenAmountB\": 1.25}");
		var params = GsonTools.readJson(path, HybridParameters.class).validate();
		assertEquals(3.0, params.getLowPassSigma());
		assertEquals(3.0, params.getHighPassSigma());
		assertEquals(1.25, params.getSharpenAmountB());
		assertEquals(HybridParameters.DEFAULT_SHARPEN_AMOUNT_C, params.getSharpenAmountC());
		
		Files.writeString(path, "{\"lowPassSigma\": -3.0}");
		var invalid = GsonTools.readJson(path, HybridParameters.class);
		assertThrows(IllegalArgumentException.class, () -> invalid.validate());
	}
	
	@Test
	public void test_writeJson() {
		var params = HybridParameters.getDefault().toBuilder().highPassSigma(1.0).build();
		var gson = GsonTools.getInstance();
		var params2 = gson.fromJson(gson.toJson(params), HybridParameters.class);
		assertEquals(params, params2);
	}

}
