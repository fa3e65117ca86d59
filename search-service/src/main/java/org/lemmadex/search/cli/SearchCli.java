package org.lemmadex.search.cli;

import org.lemmadex.search.bootstrap.SearchBootstrap;
import org.lemmadex.search.config.SearchConfig;
import org.lemmadex.search.service.SearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.SortedSet;

/**
 * One-shot boolean search from the command line.
 *
 * <p>The query is taken from the arguments, joined by spaces; without arguments it is read from standard
 * input after a prompt.</p>
 */
public final class SearchCli {
    private static final Logger logger = LoggerFactory.getLogger(SearchCli.class);

    static final String EXAMPLE = "(cleopatra AND caesar) OR (antony AND cicero) OR pompey";

    private SearchCli() {}

    public static void main(String[] args) {
        try {
            SearchService service = SearchBootstrap.buildService(SearchConfig.load());
            service.reload();
            BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            run(args, stdin, System.out, service);
        } catch (IOException e) {
            logger.error("Search failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static void run(String[] args, BufferedReader in, PrintStream out, SearchService service) throws IOException {
        String query;
        if (args.length > 0) {
            query = String.join(" ", args).strip();
        } else {
            out.println("Boolean search. Operators: AND, OR, NOT. Parentheses group sub-queries.");
            out.println("Example: " + EXAMPLE);
            out.println();
            out.print("Query: ");
            out.flush();
            String line = in.readLine();
            query = line == null ? "" : line.strip();
        }

        if (query.isEmpty()) {
            out.println("Empty query.");
            return;
        }

        SortedSet<Integer> docIds = service.searchIds(query);
        out.println();
        out.println("Found documents: " + docIds.size());
        for (int docId : docIds) {
            out.println("  " + docId + "\t" + service.urlOf(docId));
        }
    }
}
