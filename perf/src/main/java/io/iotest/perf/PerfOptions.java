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
package io.iotest.perf;

import io.iotest.client.ClientOptions;
import io.iotest.client.ClientType;
import io.iotest.client.StorageClients;
import io.iotest.client.api.StorageClient;
import io.iotest.client.api.exceptions.BackendException;
import io.iotest.perf.output.Output;
import io.iotest.perf.output.OutputOptions;
import io.iotest.perf.output.OutputTypes;
import io.iotest.perf.output.Outputs;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

@Slf4j
@CommandLine.Command(
        name = "iotest-perf",
        mixinStandardHelpOptions = true,
        description = "Measure storage latency under fixed open-loop request rates.")
public final class PerfOptions implements Callable<Integer> {
    static final int EXIT_FAILED = 1;
    static final int EXIT_INVALID_CONFIG = 2;

    @CommandLine.Option(
            names = {"--client"},
            description = "The storage backend. supported: localfs,memory")
    String clientType = "localfs";

    @CommandLine.Option(
            names = {"--localfs-prefix"},
            description = "Directory the localfs backend writes its files to")
    Path localFsPrefix = ClientOptions.defaultLocalFsPrefix();

    @CommandLine.Option(
            names = {"--payload-size"},
            description = "Size of the values to write")
    int payloadSize = TesterConfig.DEFAULT_PAYLOAD_SIZE;

    @CommandLine.Option(
            names = {"--rates"},
            split = ",",
            defaultValue = "10,20,50,100,200,500,1000",
            description = "Target rates to test in order, ops/s")
    List<Long> targetRates;

    @CommandLine.Option(
            names = {"--duration-sec"},
            description = "Duration of each campaign in seconds")
    long durationSec = TesterConfig.DEFAULT_CAMPAIGN_DURATION.getSeconds();

    @CommandLine.Option(
            names = {"--output"},
            description = "The type of output. supported: console,log")
    String outputType = "console";

    @CommandLine.Option(
            names = {"--output-log-pretty"},
            description = "Whether pretty the data for the log output type.")
    boolean outputLogPretty = false;

    @CommandLine.Option(
            names = {"--chart"},
            negatable = true,
            defaultValue = "true",
            fallbackValue = "true",
            description = "Render a png chart per histogram with the console output")
    boolean chartEnabled = true;

    @CommandLine.Option(
            names = {"--images-dir"},
            description = "Directory the charts are written to")
    Path imagesDir = Path.of("/tmp/images");

    TesterConfig testerConfig() {
        return new TesterConfig(payloadSize, targetRates, Duration.ofSeconds(durationSec));
    }

    OutputOptions outputOptions() {
        return new OutputOptions(outputLogPretty, chartEnabled, imagesDir);
    }

    @Override
    public Integer call() {
        final TesterConfig config;
        final StorageClient client;
        final OutputTypes outputTypes;
        try {
            config = testerConfig();
            outputTypes = OutputTypes.fromString(outputType);
            client =
                    StorageClients.create(
                            ClientType.fromString(clientType), new ClientOptions(localFsPrefix));
        } catch (IllegalArgumentException ex) {
            System.err.println("invalid configuration: " + ex.getMessage());
            return EXIT_INVALID_CONFIG;
        }
        log.info("starting iotest. client={} config={}", clientType, config);

        try (Output output = Outputs.createOutput(outputTypes, outputOptions());
                Tester tester = new Tester(client, config, output)) {
            tester.test();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.error("iotest interrupted");
            return EXIT_FAILED;
        } catch (BackendException | TesterException | IOException ex) {
            log.error("iotest failed.", ex);
            System.err.println("iotest failed: " + ex.getMessage());
            return EXIT_FAILED;
        }
        log.info("iotest is done");
        return 0;
    }
}
