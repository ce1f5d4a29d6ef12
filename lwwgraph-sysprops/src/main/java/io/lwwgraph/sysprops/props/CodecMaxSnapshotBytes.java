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

package io.lwwgraph.sysprops.props;

import io.lwwgraph.sysprops.LWWGraphSysProp;
import io.lwwgraph.sysprops.parser.IntegerParser;

/**
 * Upper bound of an encoded snapshot accepted by the state codec.
 */
public final class CodecMaxSnapshotBytes extends LWWGraphSysProp<Integer, IntegerParser> {
    public static final CodecMaxSnapshotBytes INSTANCE = new CodecMaxSnapshotBytes();

    private CodecMaxSnapshotBytes() {
        super("lwwgraph_codec_max_snapshot_bytes", 256 * 1024 * 1024, IntegerParser.POSITIVE);
    }
}
