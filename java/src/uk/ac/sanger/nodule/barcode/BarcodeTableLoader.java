// Copyright (c) 2026 Genome Research Ltd.
//
// This file is part of Nodule.
//
// Nodule is free software: you can redistribute it and/or modify it under
// the terms of the GNU General Public License as published by the Free Software
// Foundation; either version 3 of the License, or (at your option) any later
// version.
//
// This program is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// this program. If not, see <http://www.gnu.org/licenses/>.

package uk.ac.sanger.nodule.barcode;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import uk.ac.sanger.nodule.data.BarcodePair;
import uk.ac.sanger.nodule.data.Well;

/**
 * Reads the barcode descriptor, a JSON object which maps each well code to a
 * list of [forward, reverse] barcode suffix pairs:
 *
 * <pre>
 * { "1A01": [["F01", "R01"]], "1A02": [["F02", "R01"], ["F02", "R13"]] }
 * </pre>
 */

public class BarcodeTableLoader {
	private final ObjectMapper mapper = new ObjectMapper();

	private final Logger logger;

	public BarcodeTableLoader(Logger logger) {
		this.logger = logger;

		mapper.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
	}

	public BarcodeTable load(File file) throws BarcodeTableException {
		if (!file.isFile() || !file.canRead())
			throw new BarcodeTableException("Cannot read the barcode descriptor " + file.getPath());

		JsonNode root;

		try {
			root = mapper.readTree(file);
		} catch (JsonProcessingException jpe) {
			throw new BarcodeTableException(jpe, "The barcode descriptor " + file.getPath() + " is not valid JSON");
		} catch (IOException ioe) {
			throw new BarcodeTableException(ioe, "Failed to read the barcode descriptor " + file.getPath());
		}

		return parse(root, file.getPath());
	}

	public BarcodeTable load(InputStream is, String source) throws BarcodeTableException {
		JsonNode root;

		try {
			root = mapper.readTree(is);
		} catch (IOException ioe) {
			throw new BarcodeTableException(ioe, "Failed to read the barcode descriptor " + source);
		}

		return parse(root, source);
	}

	protected BarcodeTable parse(JsonNode root, String source) throws BarcodeTableException {
		if (root == null || !root.isObject())
			throw new BarcodeTableException("The barcode descriptor " + source + " is not a JSON object");

		BarcodeTable table = new BarcodeTable();

		Iterator<Map.Entry<String, JsonNode>> fields = root.fields();

		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();

			String code = field.getKey();

			Well well;

			try {
				well = Well.parse(code);
			} catch (IllegalArgumentException iae) {
				throw new BarcodeTableException(iae, "Invalid well code \"" + code + "\" in " + source);
			}

			table.addWell(well, parsePairs(field.getValue(), code, source));
		}

		if (table.size() == 0)
			throw new BarcodeTableException("The barcode descriptor " + source + " does not list any wells");

		Map<BarcodePair, List<Well>> overlaps = table.findOverlaps();

		for (Map.Entry<BarcodePair, List<Well>> entry : overlaps.entrySet())
			logger.warning("Barcode pair " + entry.getKey() + " is listed under wells " + entry.getValue()
					+ "; reads will be assigned to " + entry.getValue().get(0));

		logger.info("Loaded " + table.size() + " wells from barcode descriptor " + source);

		return table;
	}

	private List<BarcodePair> parsePairs(JsonNode node, String code, String source) throws BarcodeTableException {
		if (node == null || !node.isArray())
			throw new BarcodeTableException("Well " + code + " in " + source + " does not have a list of barcode pairs");

		List<BarcodePair> pairs = new ArrayList<BarcodePair>();

		for (JsonNode element : node) {
			if (!element.isArray() || element.size() != 2 || !element.get(0).isTextual() || !element.get(1).isTextual())
				throw new BarcodeTableException("Well " + code + " in " + source
						+ " has a barcode pair which is not a list of two strings: " + element);

			pairs.add(new BarcodePair(element.get(0).asText(), element.get(1).asText()));
		}

		return pairs;
	}
}
