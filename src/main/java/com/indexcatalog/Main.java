package com.indexcatalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.indexcatalog.config.CatalogConfig;
import com.indexcatalog.core.CatalogRecord;
import com.indexcatalog.core.IndexCatalog;
import com.indexcatalog.exception.CatalogException;
import com.indexcatalog.query.RowBounds;
import com.indexcatalog.recovery.RecoveryResult;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Scanner;

/**
 * Console for a catalog configured from the environment (see {@link CatalogConfig}).
 */
public class Main {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static void main(String[] args) {
        try (IndexCatalog catalog = IndexCatalog.open(CatalogConfig.load())) {
            runConsole(catalog);
        } catch (CatalogException e) {
            System.err.println("Error [" + e.getCode() + "]: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void runConsole(IndexCatalog catalog) {
        Scanner scanner = new Scanner(System.in);
        System.out.println("Index catalog console, schema " + catalog.getSchema());
        printHelp();

        while (true) {
            System.out.print("catalog> ");
            if (!scanner.hasNextLine()) break;
            String input = scanner.nextLine().trim();

            if (input.equals("quit")) break;
            if (input.isEmpty()) continue;

            try {
                execute(catalog, input);
            } catch (CatalogException e) {
                System.err.println("Error [" + e.getCode() + "]: " + e.getMessage());
            } catch (IOException | IllegalArgumentException e) {
                System.err.println("Bad input: " + e.getMessage());
            }
        }
    }

    static void execute(IndexCatalog catalog, String input) throws CatalogException, IOException {
        String command = input.split("\\s+", 2)[0].toLowerCase();
        String rest = input.substring(command.length()).trim();

        switch (command) {
            case "insert": {
                CatalogRecord record = CatalogRecord.of(parseJson(rest));
                catalog.insert(record);
                System.out.println("INSERT " + record);
                break;
            }
            case "query": {
                Argument arg = Argument.parse(rest);
                List<CatalogRecord> results = catalog.query(toFilter(arg.json), arg.bounds);
                System.out.println(results.size() + " record(s)");
                for (CatalogRecord record : results) {
                    System.out.println("  " + objectMapper.writeValueAsString(record));
                }
                break;
            }
            case "delete": {
                Argument arg = Argument.parse(rest);
                int deleted = catalog.delete(toFilter(arg.json), arg.bounds);
                System.out.println("DELETE " + deleted + " record(s)");
                break;
            }
            case "recover": {
                RecoveryResult result = catalog.recover();
                System.out.println("RECOVER " + result);
                break;
            }
            case "checkpoint":
                System.out.println("CHECKPOINT " + catalog.getWal().getCheckpoint().orElse("(none)"));
                break;
            case "help":
                printHelp();
                break;
            default:
                System.out.println("Unknown command: " + command);
        }
    }

    private static void printHelp() {
        System.out.println("Commands:");
        System.out.println("  insert <json>                   - Insert a record, e.g. insert {\"userId\":\"u1\",\"email\":\"a@x.com\"}");
        System.out.println("  query <json> [rowFrom] [rowTo]  - Records matching every field of the filter");
        System.out.println("  delete <json> [rowFrom] [rowTo] - Delete records matching the filter");
        System.out.println("  recover                         - Replay unapplied WAL entries");
        System.out.println("  checkpoint                      - Show the last applied WAL entry");
        System.out.println("  help                            - Show this help");
        System.out.println("  quit                            - Exit");
    }

    private static Map<String, Object> parseJson(String json) throws IOException {
        if (json.isEmpty()) {
            throw new IllegalArgumentException("expected a JSON object");
        }
        return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() { });
    }

    private static Map<String, String> toFilter(String json) throws IOException {
        return new LinkedHashMap<>(CatalogRecord.of(parseJson(json)).asMap());
    }

    /**
     * A JSON object followed by optional row bounds.
     */
    private static final class Argument {
        final String json;
        final RowBounds bounds;

        private Argument(String json, RowBounds bounds) {
            this.json = json;
            this.bounds = bounds;
        }

        static Argument parse(String rest) {
            int end = rest.lastIndexOf('}');
            if (!rest.startsWith("{") || end < 0) {
                throw new IllegalArgumentException("expected a JSON object");
            }
            String[] tail = rest.substring(end + 1).trim().split("\\s+");
            String rowFrom = tail.length > 0 ? tail[0] : null;
            String rowTo = tail.length > 1 ? tail[1] : null;
            return new Argument(rest.substring(0, end + 1), RowBounds.of(rowFrom, rowTo));
        }
    }
}
