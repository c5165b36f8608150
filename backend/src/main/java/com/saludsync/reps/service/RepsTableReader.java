package com.saludsync.reps.service;

import com.saludsync.reps.dto.RawRow;
import com.saludsync.reps.dto.RepsTable;
import com.saludsync.reps.exception.RepsParsingException;
import com.saludsync.reps.util.FieldNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the "xls" files produced by the REPS portal, which are HTML documents holding a single table.
 * The portal writes the real header names into the first row of cells, not into a thead.
 */
@Component
public class RepsTableReader {

    private static final Logger log = LoggerFactory.getLogger(RepsTableReader.class);

    private static final Charset WINDOWS_1252 = Charset.forName("windows-1252");

    public RepsTable read(InputStream in, String fileName) {
        try {
            return read(in.readAllBytes(), fileName);
        } catch (IOException e) {
            throw new RepsParsingException(fileName, "No se pudo leer el archivo " + fileName + ": " + e.getMessage(), e);
        }
    }

    public RepsTable read(byte[] bytes, String fileName) {
        if (bytes == null || bytes.length == 0) {
            throw new RepsParsingException(fileName, "El archivo " + fileName + " está vacío");
        }
        String text = decode(bytes);
        Document doc = Jsoup.parse(text);
        Element table = doc.selectFirst("table");
        if (table == null) {
            throw new RepsParsingException(fileName, "El archivo " + fileName + " no contiene una tabla HTML");
        }

        List<List<String>> rawRows = new ArrayList<>();
        for (Element tr : table.select("tr")) {
            List<String> cells = new ArrayList<>();
            for (Element cell : tr.children()) {
                String tag = cell.normalName();
                if ("td".equals(tag) || "th".equals(tag)) cells.add(cell.text());
            }
            rawRows.add(cells);
        }

        int headerAt = -1;
        for (int i = 0; i < rawRows.size(); i++) {
            if (rawRows.get(i).stream().anyMatch(c -> !FieldNormalizer.clean(c).isEmpty())) {
                headerAt = i;
                break;
            }
        }
        if (headerAt < 0) {
            throw new RepsParsingException(fileName, "La tabla de " + fileName + " no tiene filas");
        }

        List<String> headerNames = new ArrayList<>();
        List<String> headerKeys = headerKeys(rawRows.get(headerAt), headerNames);
        if (headerKeys.isEmpty()) {
            throw new RepsParsingException(fileName, "La tabla de " + fileName + " no tiene columnas");
        }

        List<RawRow> rows = new ArrayList<>();
        int position = 0;
        for (int i = headerAt + 1; i < rawRows.size(); i++) {
            position++;
            List<String> cells = rawRows.get(i);
            Map<String, String> values = new LinkedHashMap<>();
            for (int c = 0; c < headerKeys.size(); c++) {
                values.put(headerKeys.get(c), c < cells.size() ? FieldNormalizer.clean(cells.get(c)) : "");
            }
            RawRow row = new RawRow(position, values);
            if (!row.isBlank()) rows.add(row);
        }
        if (rows.isEmpty()) {
            throw new RepsParsingException(fileName, "La tabla de " + fileName + " no tiene filas de datos");
        }

        log.info("[REPS_PARSER] {}: {} columns, {} data rows ({} blank dropped)",
                fileName, headerKeys.size(), rows.size(), position - rows.size());
        return new RepsTable(fileName, headerNames, rows);
    }

    private static List<String> headerKeys(List<String> headerCells, List<String> displayNames) {
        List<String> keys = new ArrayList<>();
        Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < headerCells.size(); i++) {
            String name = FieldNormalizer.repairEncoding(headerCells.get(i));
            String key = FieldNormalizer.headerKey(name);
            if (key.isEmpty()) key = "column_" + (i + 1);
            int n = seen.merge(key, 1, Integer::sum);
            if (n > 1) key = key + "_" + n;
            keys.add(key);
            displayNames.add(name.isEmpty() ? key : name);
        }
        return keys;
    }

    // Strict UTF-8 first; the portal also serves Windows-1252 files.
    static String decode(byte[] bytes) {
        try {
            String s = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return s.startsWith("\uFEFF") ? s.substring(1) : s;
        } catch (CharacterCodingException e) {
            return new String(bytes, WINDOWS_1252);
        }
    }
}
