package org.lemmadex.search;

import org.lemmadex.search.bootstrap.SearchBootstrap;

public class SearchApp {
    public static void main(String[] args) {
        SearchBootstrap.run();
    }
}
