package com.cognia.eda;

import com.cognia.eda.config.CogniaProperties;
import com.cognia.eda.dataset.CsvDatasetLoader;
import com.cognia.eda.dataset.Dataset;
import com.cognia.eda.report.EdaReportService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code cognia <input.csv> [output.html] [--show-full-correlation]}
 */
@SpringBootApplication
@EnableConfigurationProperties(CogniaProperties.class)
@RequiredArgsConstructor
public class CogniaApplication implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(CogniaApplication.class);

    static final String SHOW_FULL_CORRELATION_FLAG = "--show-full-correlation";

    private final CsvDatasetLoader datasetLoader;
    private final EdaReportService edaReportService;
    private final CogniaProperties properties;

    public static void main(String[] args) {
        SpringApplication.run(CogniaApplication.class, args);
    }

    @Bean
    static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Override
    public void run(String... args) {
        List<String> positional = new ArrayList<>();
        boolean showFullCorrelation = properties.getReport().isShowFullCorrelation();
        for (String arg : args) {
            if (SHOW_FULL_CORRELATION_FLAG.equals(arg)) {
                showFullCorrelation = true;
            } else if (!arg.startsWith("--")) {
                positional.add(arg);
            }
        }

        if (positional.isEmpty()) {
            logger.info("Usage: cognia <input.csv> [output.html] [{}]", SHOW_FULL_CORRELATION_FLAG);
            return;
        }

        Path input = Paths.get(positional.get(0));
        Path output = Paths.get(positional.size() > 1 ? positional.get(1) : properties.getReport().getOutputFile());

        Dataset dataset = datasetLoader.load(input);
        edaReportService.generate(dataset, output, showFullCorrelation);
    }
}
