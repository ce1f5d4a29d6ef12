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

import com.google.common.base.Preconditions;

public class IntegerParser implements PropParser<Integer> {
    public static final IntegerParser POSITIVE = new IntegerParser(1, Integer.MAX_VALUE);
    private final int lowBound;
    private final int highBoundEx;

    private IntegerParser(int lowBound, int highBoundEx) {
        this.lowBound = lowBound;
        this.highBoundEx = highBoundEx;
    }

    @Override
    public Integer parse(String value) {
        int val;
        try {
            val = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new SysPropParseException(String.format("'%s' is not an integer", value), e);
        }
        if (lowBound <= val && val < highBoundEx) {
            return val;
        }
        throw new SysPropParseException(String.format("%d is out of bound [%d,%d)", val, lowBound, highBoundEx));
    }

    public static IntegerParser from(int lowBound, int highBoundEx) {
        Preconditions.checkArgument(lowBound < highBoundEx, "Empty bound [%s,%s)", lowBound, highBoundEx);
        return new IntegerParser(lowBound, highBoundEx);
    }
}
