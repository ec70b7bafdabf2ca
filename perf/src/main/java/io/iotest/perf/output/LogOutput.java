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

import com.fasterxml.jackson.databind.ObjectMapper;
import io.iotest.perf.CampaignResult;
import lombok.extern.slf4j.Slf4j;

/** Logs every campaign as a single JSON document. */
@Slf4j
final class LogOutput implements Output {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final boolean pretty;

    LogOutput(boolean pretty) {
        this.pretty = pretty;
    }

    @Override
    public void report(CampaignResult result) {
        log.info(serialize(CampaignReportSnapshot.fromResult(result, System.currentTimeMillis())));
    }

    String serialize(CampaignReportSnapshot snapshot) {
        try {
            if (pretty) {
                return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
            }
            return MAPPER.writeValueAsString(snapshot);
        } catch (Throwable ex) {
            throw new OutputException(ex.getMessage(), ex);
        }
    }

    @Override
    public void close() {}
}
