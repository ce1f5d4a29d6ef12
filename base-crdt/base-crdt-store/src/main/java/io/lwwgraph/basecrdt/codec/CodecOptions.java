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

package io.lwwgraph.basecrdt.codec;

import io.lwwgraph.sysprops.props.CodecMaxSnapshotBytes;
import io.lwwgraph.sysprops.props.CodecPrettyPrint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.Accessors;

@Builder(toBuilder = true)
@Accessors(chain = true, fluent = true)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CodecOptions {
    @Builder.Default
    private boolean prettyPrint = CodecPrettyPrint.INSTANCE.get();
    @Builder.Default
    private int maxSnapshotBytes = CodecMaxSnapshotBytes.INSTANCE.get();
}
