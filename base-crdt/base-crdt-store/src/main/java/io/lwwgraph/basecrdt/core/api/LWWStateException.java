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

package io.lwwgraph.basecrdt.core.api;

public class LWWStateException extends RuntimeException {
    private LWWStateException(String message) {
        super(message);
    }

    public static NotFoundException addNotFound(Object element) {
        return new NotFoundException("No add recorded for element: " + element);
    }

    public static NotFoundException removeNotFound(Object element) {
        return new NotFoundException("No remove recorded for element: " + element);
    }

    public static class NotFoundException extends LWWStateException {
        private NotFoundException(String message) {
            super(message);
        }
    }
}
