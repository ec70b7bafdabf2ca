/*
 * Copyright © 2022-2024 StreamNative Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.iotest.perf.output;

import java.nio.file.Path;

/**
 * @param logPretty pretty print the JSON written by the log output
 * @param chartEnabled render a PNG chart next to every console histogram
 * @param imagesDir directory the charts are written to
 */
public record OutputOptions(boolean logPretty, boolean chartEnabled, Path imagesDir) {}
