package com.credit.card.fraud.scoring.artifact.service;

import com.credit.card.fraud.scoring.features.exceptions.InvalidRawRecordException;
import com.credit.card.fraud.scoring.features.model.RawRecord;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvRawRecordReaderTest {

    private final CsvRawRecordReader reader = new CsvRawRecordReader("Class");

    @Test
    void read_shouldParseNumbersAndStrings_andDropLabel() {
        String csv = "Time,Amount,V1,Class,merchant_id\n"
                + "0,149.62,-1.3598,0,m1\n"
                + "\n"
                + "406,2.69,1.19e-1,1,\"m2\"\n";

        List<RawRecord> records = reader.read(new StringReader(csv));

        assertEquals(2, records.size());
        RawRecord second = records.get(1);
        assertEquals(406.0, second.time());
        assertEquals(2.69, second.amount());
        assertEquals(0.119, (Double) second.get("V1").orElseThrow(), 1e-12);
        assertEquals("m2", second.get("merchant_id").orElseThrow());
        assertFalse(second.has("Class"));
    }

    @Test
    void read_shouldTreatEmptyCellAsAbsent() {
        List<RawRecord> records = reader.read(new StringReader("Time,Amount,merchant_id\n1,2,\n"));

        assertFalse(records.get(0).has("merchant_id"));
    }

    @Test
    void read_shouldFailOnColumnCountMismatch() {
        String csv = "Time,Amount\n1,2\n3\n";

        InvalidRawRecordException ex = assertThrows(InvalidRawRecordException.class,
                () -> reader.read(new StringReader(csv)));
        assertTrue(ex.getMessage().contains("line 3"));
    }

    @Test
    void read_shouldFailWithoutHeader() {
        assertThrows(InvalidRawRecordException.class, () -> reader.read(new StringReader("")));
    }
}
