////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.treewalk.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.treewalk.analysis.ExclusivityMode;
import com.tomaszrup.treewalk.walk.TraversalStrategy;

/**
 * Reads {@link TreeWalkOptions} from a JSON object such as:
 *
 * <pre>{@code
 * {
 *   "traversal": "recursive",
 *   "exclusivity": "strict",
 *   "logLevel": "DEBUG"
 * }
 * }</pre>
 *
 * <p>Missing, ill-typed or unknown values keep their defaults; a warning is
 * logged for each value that is present but unusable.</p>
 */
public final class TreeWalkOptionsParser {

	private static final Logger logger = LoggerFactory.getLogger(TreeWalkOptionsParser.class);

	/** Classpath resource consulted by {@link #loadDefaults()}. */
	public static final String DEFAULTS_RESOURCE = "/treewalk.json";

	private static final String TRAVERSAL_OPTION = "traversal";
	private static final String EXCLUSIVITY_OPTION = "exclusivity";
	private static final String LOG_LEVEL_OPTION = "logLevel";

	private TreeWalkOptionsParser() {
		// utility class
	}

	/**
	 * @return the parsed options; {@link TreeWalkOptions#defaults()} when the
	 *         input is not a JSON object
	 */
	public static TreeWalkOptions parse(JsonElement options) {
		if (options == null || !options.isJsonObject()) {
			return TreeWalkOptions.defaults();
		}
		JsonObject opts = options.getAsJsonObject();
		TreeWalkOptions defaults = TreeWalkOptions.defaults();

		TraversalStrategy traversal = parseEnumOption(opts, TRAVERSAL_OPTION,
				TraversalStrategy.class, defaults.getTraversalStrategy());
		ExclusivityMode exclusivity = parseEnumOption(opts, EXCLUSIVITY_OPTION,
				ExclusivityMode.class, defaults.getExclusivityMode());
		String logLevel = null;
		if (opts.has(LOG_LEVEL_OPTION)) {
			JsonElement value = opts.get(LOG_LEVEL_OPTION);
			if (value.isJsonPrimitive()) {
				logLevel = value.getAsString();
			} else {
				logger.warn("Option '{}' must be a string, ignoring it", LOG_LEVEL_OPTION);
			}
		}
		TreeWalkOptions parsed = new TreeWalkOptions(traversal, exclusivity, logLevel);
		logger.debug("Parsed {}", parsed);
		return parsed;
	}

	/**
	 * @throws JsonParseException if {@code json} is not well-formed JSON
	 */
	public static TreeWalkOptions parse(String json) {
		return parse(JsonParser.parseString(json));
	}

	/**
	 * Reads {@value #DEFAULTS_RESOURCE} from the classpath, or returns
	 * {@link TreeWalkOptions#defaults()} when it is absent.
	 */
	public static TreeWalkOptions loadDefaults() {
		try (InputStream in = TreeWalkOptionsParser.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (in == null) {
				return TreeWalkOptions.defaults();
			}
			try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
				return parse(JsonParser.parseReader(reader));
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
		}
	}

	private static <E extends Enum<E>> E parseEnumOption(JsonObject opts, String name, Class<E> type, E fallback) {
		if (!opts.has(name)) {
			return fallback;
		}
		JsonElement value = opts.get(name);
		if (!value.isJsonPrimitive()) {
			logger.warn("Option '{}' must be a string, keeping {}", name, fallback);
			return fallback;
		}
		String text = value.getAsString().trim().toUpperCase(Locale.ROOT);
		for (E constant : type.getEnumConstants()) {
			if (constant.name().equals(text)) {
				return constant;
			}
		}
		logger.warn("Unknown value '{}' for option '{}', keeping {}", value.getAsString(), name, fallback);
		return fallback;
	}

	/**
	 * Dynamically set the Logback root logger level from a string value.
	 * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
	 * Invalid values are ignored and a warning is logged.
	 *
	 * @return whether the level was applied
	 */
	public static boolean applyLogLevel(String levelName) {
		if (levelName == null) {
			return false;
		}
		ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
		if (level == null) {
			logger.warn("Unknown log level '{}', keeping current level", levelName);
			return false;
		}
		org.slf4j.Logger rootLogger = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		if (!(rootLogger instanceof ch.qos.logback.classic.Logger)) {
			logger.warn("Logging backend is not Logback, cannot set level '{}'", levelName);
			return false;
		}
		ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) rootLogger;
		ch.qos.logback.classic.Level previous = root.getLevel();
		root.setLevel(level);
		logger.info("Log level changed from {} to {}", previous, level);
		return true;
	}
}
