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

import java.io.IOException;

public class CodecException extends RuntimeException {
    private CodecException(String message) {
        super(message);
    }

    private CodecException(String message, Throwable cause) {
        super(message, cause);
    }

    public static CodecException malformed(String reason) {
        return new CodecException("Malformed snapshot: " + reason);
    }

    public static CodecException malformed(String reason, Throwable cause) {
        return new CodecException("Malformed snapshot: " + reason, cause);
    }

    public static CodecException tooLarge(int size, int limit) {
        return new CodecException(String.format("Snapshot of %d bytes exceeds the limit of %d bytes", size, limit));
    }

    public static CodecException encodeFailed(IOException cause) {
        return new CodecException("Unable to encode snapshot", cause);
    }
}
