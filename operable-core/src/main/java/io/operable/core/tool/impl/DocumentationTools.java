package io.operable.core.tool.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.operable.core.render.MarkdownReport;
import io.operable.core.tool.CallResult;
import io.operable.core.tool.ParameterSchema;
import io.operable.core.tool.ParameterSpec;
import io.operable.core.tool.ToolArguments;
import io.operable.core.tool.ToolDefinition;
import io.operable.core.tool.ToolGroup;
import io.operable.core.tool.impl.DocumentationCatalog.DocEntry;
import io.operable.core.tool.impl.DocumentationCatalog.ErrorDoc;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

public final class DocumentationTools implements ToolGroup {
    private final ObjectMapper mapper;

    public DocumentationTools(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String area() {
        return "docs";
    }

    @Override
    public List<ToolDefinition> tools() throws IOException {
        DocumentationCatalog catalog = DocumentationCatalog.load(mapper);
        return List.of(
            new ToolDefinition(
                "search_gcp_docs",
                "Searches Google Cloud documentation",
                searchSchema(),
                (context, args) -> searchResults(args, "Google Cloud", catalog.searchGcp(args.string("query")),
                    "[Google Cloud documentation](https://cloud.google.com/docs)")
            ),
            new ToolDefinition(
                "search_k8s_docs",
                "Searches Kubernetes documentation",
                searchSchema(),
                (context, args) -> searchResults(args, "Kubernetes", catalog.searchKubernetes(args.string("query")),
                    "[Kubernetes documentation](https://kubernetes.io/docs/)")
            ),
            new ToolDefinition(
                "get_error_docs",
                "Gets documentation for a specific error code or message",
                ParameterSchema.of(
                    ParameterSpec.optionalString("error_code", "The error code to look up"),
                    ParameterSpec.optionalString("error_message", "The error message to look up")
                ),
                (context, args) -> errorDocs(catalog, args)
            )
        );
    }

    private static ParameterSchema searchSchema() {
        return ParameterSchema.of(
            ParameterSpec.requiredString("query", "The search query"),
            ParameterSpec.optionalNumber("max_results", "Maximum number of results to return (default: 5)", 5)
        );
    }

    static CallResult searchResults(ToolArguments args, String source, List<DocEntry> matches, String moreLink) {
        String query = args.string("query");
        if (matches.isEmpty()) {
            return CallResult.text("No documentation found for query: " + query);
        }
        MarkdownReport report = new MarkdownReport()
            .heading(1, source + " Documentation Search Results for \"" + query + "\"");
        int limit = Math.min(matches.size(), args.integer("max_results"));
        for (int i = 0; i < limit; i++) {
            DocEntry entry = matches.get(i);
            report.heading(2, (i + 1) + ". " + entry.title())
                .paragraph("**URL**: [" + entry.link() + "](" + entry.link() + ")")
                .paragraph(entry.snippet());
        }
        report.paragraph("For more results, visit the " + moreLink + ".");
        return CallResult.text(report.render());
    }

    static CallResult errorDocs(DocumentationCatalog catalog, ToolArguments args) {
        String code = args.string("error_code");
        String message = args.string("error_message");
        if (code.isBlank() && message.isBlank()) {
            return CallResult.error("either error_code or error_message must be provided");
        }

        Optional<ErrorDoc> found = code.isBlank() ? Optional.empty() : catalog.byCode(code);
        if (found.isEmpty() && !message.isBlank()) {
            found = catalog.byMessage(message);
        }

        if (found.isEmpty()) {
            StringBuilder text = new StringBuilder("No documentation found for the specified error.");
            if (!code.isBlank()) {
                text.append(" Error code: ").append(code);
            }
            if (!message.isBlank()) {
                text.append(" Error message: ").append(message);
            }
            text.append("\n\nTry searching the Google Cloud documentation or Kubernetes documentation for more information.");
            return CallResult.text(text.toString());
        }

        ErrorDoc doc = found.get();
        MarkdownReport report = new MarkdownReport()
            .heading(1, doc.title())
            .heading(2, "Description")
            .paragraph(doc.description())
            .heading(2, "Solution")
            .numbered(doc.solution());
        if (!doc.references().isEmpty()) {
            report.heading(2, "References");
            doc.references().forEach(reference -> report.bullet("[" + reference + "](" + reference + ")"));
        }
        return CallResult.text(report.render());
    }
}
