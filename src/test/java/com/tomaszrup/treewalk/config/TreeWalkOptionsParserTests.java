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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import com.tomaszrup.treewalk.analysis.ExclusivityMode;
import com.tomaszrup.treewalk.walk.TraversalStrategy;

class TreeWalkOptionsParserTests {

	private Logger rootLogger;
	private Level originalLevel;

	@BeforeEach
	void setup() {
		rootLogger = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		originalLevel = rootLogger.getLevel();
	}

	@AfterEach
	void tearDown() {
		rootLogger.setLevel(originalLevel);
	}

	@Test
	void testParseAllOptions() {
		JsonObject options = new JsonObject();
		options.addProperty("traversal", "recursive");
		options.addProperty("exclusivity", "STRICT");
		options.addProperty("logLevel", "debug");

		TreeWalkOptions parsed = TreeWalkOptionsParser.parse(options);

		Assertions.assertEquals(TraversalStrategy.RECURSIVE, parsed.getTraversalStrategy());
		Assertions.assertEquals(ExclusivityMode.STRICT, parsed.getExclusivityMode());
		Assertions.assertEquals("debug", parsed.getLogLevel());
	}

	@Test
	void testMissingOptionsKeepDefaults() {
		TreeWalkOptions parsed = TreeWalkOptionsParser.parse("{\"exclusivity\": \" strict \"}");

		Assertions.assertEquals(TraversalStrategy.ITERATIVE, parsed.getTraversalStrategy());
		Assertions.assertEquals(ExclusivityMode.STRICT, parsed.getExclusivityMode());
		Assertions.assertNull(parsed.getLogLevel());
	}

	@Test
	void testUnknownValuesKeepDefaults() {
		TreeWalkOptions parsed = TreeWalkOptionsParser.parse(
				"{\"traversal\": \"sideways\", \"exclusivity\": [\"strict\"]}");

		Assertions.assertEquals(TraversalStrategy.ITERATIVE, parsed.getTraversalStrategy());
		Assertions.assertEquals(ExclusivityMode.COMPATIBLE, parsed.getExclusivityMode());
	}

	@Test
	void testIllTypedLogLevelIsIgnoredWithWarning() {
		Logger parserLogger = (Logger) LoggerFactory.getLogger(TreeWalkOptionsParser.class);
		ListAppender<ILoggingEvent> appender = new ListAppender<>();
		appender.start();
		parserLogger.addAppender(appender);
		try {
			TreeWalkOptions parsed = TreeWalkOptionsParser.parse("{\"logLevel\": {\"root\": \"debug\"}}");

			Assertions.assertNull(parsed.getLogLevel());
			Assertions.assertEquals(1, appender.list.size());
			Assertions.assertEquals(Level.WARN, appender.list.get(0).getLevel());
			Assertions.assertTrue(appender.list.get(0).getFormattedMessage().contains("logLevel"));
		} finally {
			parserLogger.detachAppender(appender);
		}
	}

	@Test
	void testNonObjectInputGivesDefaults() {
		TreeWalkOptions defaults = TreeWalkOptions.defaults();

		for (TreeWalkOptions parsed : new TreeWalkOptions[] {
				TreeWalkOptionsParser.parse((com.google.gson.JsonElement) null),
				TreeWalkOptionsParser.parse(JsonNull.INSTANCE),
				TreeWalkOptionsParser.parse(new JsonArray()) }) {
			Assertions.assertEquals(defaults.getTraversalStrategy(), parsed.getTraversalStrategy());
			Assertions.assertEquals(defaults.getExclusivityMode(), parsed.getExclusivityMode());
			Assertions.assertNull(parsed.getLogLevel());
		}
	}

	@Test
	void testMalformedJsonThrows() {
		Assertions.assertThrows(JsonParseException.class, () -> TreeWalkOptionsParser.parse("{\"traversal\": "));
	}

	@Test
	void testLoadDefaultsReadsClasspathResource() {
		// src/test/resources/treewalk.json selects the recursive strategy
		TreeWalkOptions loaded = TreeWalkOptionsParser.loadDefaults();

		Assertions.assertEquals(TraversalStrategy.RECURSIVE, loaded.getTraversalStrategy());
		Assertions.assertEquals(ExclusivityMode.COMPATIBLE, loaded.getExclusivityMode());
	}

	@Test
	void testWithMethodsReturnCopies() {
		TreeWalkOptions defaults = TreeWalkOptions.defaults();
		TreeWalkOptions strict = defaults.withExclusivityMode(ExclusivityMode.STRICT);

		Assertions.assertEquals(ExclusivityMode.COMPATIBLE, defaults.getExclusivityMode());
		Assertions.assertEquals(ExclusivityMode.STRICT, strict.getExclusivityMode());
		Assertions.assertEquals(TraversalStrategy.RECURSIVE,
				strict.withTraversalStrategy(TraversalStrategy.RECURSIVE).getTraversalStrategy());
	}

	@Test
	void testApplyLogLevel() {
		Assertions.assertTrue(TreeWalkOptionsParser.applyLogLevel("error"));
		Assertions.assertEquals(Level.ERROR, rootLogger.getLevel());

		Assertions.assertFalse(TreeWalkOptionsParser.applyLogLevel("loud"));
		Assertions.assertEquals(Level.ERROR, rootLogger.getLevel());

		Assertions.assertFalse(TreeWalkOptionsParser.applyLogLevel(null));
	}
}
