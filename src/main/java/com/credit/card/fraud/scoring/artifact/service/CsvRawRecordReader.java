package com.credit.card.fraud.scoring.artifact.service;

import com.credit.card.fraud.scoring.features.exceptions.InvalidRawRecordException;
import com.credit.card.fraud.scoring.features.model.RawRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 헤더가 있는 학습 CSV -> RawRecord 목록. 숫자 형태의 값은 Double로 읽는다.
 */
@Slf4j
public class CsvRawRecordReader {

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    private final String labelField;

    public CsvRawRecordReader(String labelField) {
        this.labelField = labelField;
    }

    public List<RawRecord> read(Reader source) {
        List<RawRecord> records = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(source)) {
            String headerLine = reader.readLine();
            if (headerLine == null || headerLine.isBlank()) {
                throw new InvalidRawRecordException("header", "CSV has no header line");
            }
            String[] headers = split(headerLine);

            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) continue;

                String[] values = split(line);
                if (values.length != headers.length) {
                    throw new InvalidRawRecordException("line " + lineNumber,
                            "Column count mismatch at line " + lineNumber + ": expected " + headers.length
                                    + ", got " + values.length);
                }

                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 0; i < headers.length; i++) {
                    row.put(headers[i], parseValue(values[i]));
                }
                records.add(RawRecord.of(row, labelField));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read CSV: " + e.getMessage(), e);
        }

        log.info("CSV parsed: {} records", records.size());
        return records;
    }

    private static String[] split(String line) {
        String[] parts = line.split(",", -1);
        for (int i = 0; i < parts.length; i++) {
            parts[i] = unquote(parts[i].trim());
        }
        return parts;
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static Object parseValue(String value) {
        return NUMBER.matcher(value).matches() ? (Object) Double.parseDouble(value) : value;
    }
}
