/*
 * Copyright (c) 2024. The LWWGraph Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *    http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and limitations under the License.
 */

package io.lwwgraph.sysprops.parser;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import org.testng.annotations.Test;

public class PropParserTest {
    @Test
    public void parseBoolean() {
        assertTrue(BooleanParser.INSTANCE.parse("true"));
        assertTrue(BooleanParser.INSTANCE.parse("on"));
        assertTrue(BooleanParser.INSTANCE.parse("1"));
        assertFalse(BooleanParser.INSTANCE.parse("no"));
        assertFalse(BooleanParser.INSTANCE.parse("0"));
        assertThrows(SysPropParseException.class, () -> BooleanParser.INSTANCE.parse("2"));
    }

    @Test
    public void parseInteger() {
        IntegerParser parser = IntegerParser.from(-10, 10);
        assertEquals(parser.parse("-10"), Integer.valueOf(-10));
        assertEquals(parser.parse("9"), Integer.valueOf(9));
        assertThrows(SysPropParseException.class, () -> parser.parse("10"));
        assertThrows(SysPropParseException.class, () -> parser.parse("ten"));
        assertThrows(SysPropParseException.class, () -> IntegerParser.POSITIVE.parse("0"));
        assertThrows(IllegalArgumentException.class, () -> IntegerParser.from(1, 1));
    }
}
