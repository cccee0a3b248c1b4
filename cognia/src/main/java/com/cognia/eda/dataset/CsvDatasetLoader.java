package com.cognia.eda.dataset;

import com.cognia.eda.exception.DatasetLoadException;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Component
public class CsvDatasetLoader {

    private static final Logger logger = LoggerFactory.getLogger(CsvDatasetLoader.class);

    public Dataset load(Path filePath) {
        if (!Files.isRegularFile(filePath)) {
            throw new DatasetLoadException("Dataset file not found: " + filePath);
        }
        try (BufferedReader br = Files.newBufferedReader(filePath, StandardCharsets.UTF_8)) {
            Dataset dataset = read(br);
            logger.info("Loaded {} rows and {} columns from {}",
                    dataset.getRowCount(), dataset.getColumnCount(), filePath.getFileName());
            return dataset;
        } catch (IOException e) {
            throw new DatasetLoadException("Could not read dataset " + filePath, e);
        }
    }

    public Dataset read(Reader source) {
        try (CSVReader csvReader = new CSVReader(source)) {
            String[] header = csvReader.readNext();
            if (header == null) {
                throw new DatasetLoadException("Dataset has no header row");
            }
            List<String[]> rows = new ArrayList<>();
            String[] line;
            while ((line = csvReader.readNext()) != null) {
                if (isBlankLine(line)) {
                    continue;
                }
                rows.add(line);
            }
            return Dataset.fromRows(Arrays.stream(header).map(String::trim).toList(), rows);
        } catch (IOException | CsvValidationException e) {
            throw new DatasetLoadException("Could not parse CSV data", e);
        }
    }

    private static boolean isBlankLine(String[] line) {
        return line.length == 1 && line[0].isBlank();
    }
}
