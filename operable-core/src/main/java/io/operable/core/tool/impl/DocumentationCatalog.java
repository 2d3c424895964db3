package io.operable.core.tool.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-only documentation snippets bundled under {@code /io/operable/docs}. Loaded once when the docs area registers;
 * a missing or malformed resource fails that registration.
 */
public final class DocumentationCatalog {
    static final String GCP_RESOURCE = "/io/operable/docs/gcp.json";
    static final String K8S_RESOURCE = "/io/operable/docs/k8s.json";
    static final String ERRORS_RESOURCE = "/io/operable/docs/errors.json";

    private final List<DocEntry> gcp;
    private final List<DocEntry> kubernetes;
    private final List<ErrorDoc> errors;

    public DocumentationCatalog(List<DocEntry> gcp, List<DocEntry> kubernetes, List<ErrorDoc> errors) {
        this.gcp = List.copyOf(gcp);
        this.kubernetes = List.copyOf(kubernetes);
        this.errors = List.copyOf(errors);
    }

    public static DocumentationCatalog load(ObjectMapper mapper) throws IOException {
        return new DocumentationCatalog(
            read(mapper, GCP_RESOURCE, new TypeReference<List<DocEntry>>() {
            }),
            read(mapper, K8S_RESOURCE, new TypeReference<List<DocEntry>>() {
            }),
            read(mapper, ERRORS_RESOURCE, new TypeReference<List<ErrorDoc>>() {
            })
        );
    }

    public List<DocEntry> searchGcp(String query) {
        return search(gcp, query);
    }

    public List<DocEntry> searchKubernetes(String query) {
        return search(kubernetes, query);
    }

    public Optional<ErrorDoc> byCode(String code) {
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return errors.stream().filter(doc -> doc.code().equals(normalized)).findFirst();
    }

    // First entry, in catalogue order, whose description contains the message.
    public Optional<ErrorDoc> byMessage(String message) {
        String needle = message.toLowerCase(Locale.ROOT);
        return errors.stream()
            .filter(doc -> doc.description().toLowerCase(Locale.ROOT).contains(needle))
            .findFirst();
    }

    private static List<DocEntry> search(List<DocEntry> entries, String query) {
        String needle = query.toLowerCase(Locale.ROOT);
        return entries.stream()
            .filter(entry -> entry.title().toLowerCase(Locale.ROOT).contains(needle)
                || entry.snippet().toLowerCase(Locale.ROOT).contains(needle))
            .toList();
    }

    private static <T> List<T> read(ObjectMapper mapper, String resource, TypeReference<List<T>> type)
        throws IOException {
        try (InputStream in = DocumentationCatalog.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Documentation resource not found: " + resource);
            }
            return mapper.readValue(in, type);
        }
    }

    public record DocEntry(String title, String link, String snippet, String displayLink) {
        public DocEntry {
            title = title == null ? "" : title;
            snippet = snippet == null ? "" : snippet;
        }
    }

    public record ErrorDoc(String code, String title, String description, List<String> solution, List<String> references) {
        public ErrorDoc {
            code = code == null ? "" : code;
            description = description == null ? "" : description;
            solution = solution == null ? List.of() : solution;
            references = references == null ? List.of() : references;
        }
    }
}
