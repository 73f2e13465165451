package com.nesh.catalog.catalog;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {
    private boolean loadOnStartup = true;
    private Search search = new Search();
    private Render render = new Render();
    private Hierarchy hierarchy = new Hierarchy();

    public boolean isLoadOnStartup() {
        return loadOnStartup;
    }

    public void setLoadOnStartup(boolean loadOnStartup) {
        this.loadOnStartup = loadOnStartup;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Render getRender() {
        return render;
    }

    public void setRender(Render render) {
        this.render = render;
    }

    public Hierarchy getHierarchy() {
        return hierarchy;
    }

    public void setHierarchy(Hierarchy hierarchy) {
        this.hierarchy = hierarchy;
    }

    public static class Search {
        private int maxResults = 50;
        private int snippetLength = 160;
        private int maxTariffMatches = 100;
        private List<String> stopwords = new ArrayList<>(List.of(
            "a", "o", "as", "os", "de", "da", "do", "das", "dos", "e", "em", "no", "na", "nos", "nas",
            "um", "uma", "para", "por", "com"
        ));

        public int getMaxResults() {
            return maxResults;
        }

        public void setMaxResults(int maxResults) {
            this.maxResults = maxResults;
        }

        public int getSnippetLength() {
            return snippetLength;
        }

        public void setSnippetLength(int snippetLength) {
            this.snippetLength = snippetLength;
        }

        public int getMaxTariffMatches() {
            return maxTariffMatches;
        }

        public void setMaxTariffMatches(int maxTariffMatches) {
            this.maxTariffMatches = maxTariffMatches;
        }

        public List<String> getStopwords() {
            return stopwords;
        }

        public void setStopwords(List<String> stopwords) {
            this.stopwords = stopwords;
        }
    }

    public static class Render {
        private int cacheMaxEntries = 200;
        private boolean prewarm = false;
        private int prewarmPoolSize = 4;

        public int getCacheMaxEntries() {
            return cacheMaxEntries;
        }

        public void setCacheMaxEntries(int cacheMaxEntries) {
            this.cacheMaxEntries = cacheMaxEntries;
        }

        public boolean isPrewarm() {
            return prewarm;
        }

        public void setPrewarm(boolean prewarm) {
            this.prewarm = prewarm;
        }

        public int getPrewarmPoolSize() {
            return prewarmPoolSize;
        }

        public void setPrewarmPoolSize(int prewarmPoolSize) {
            this.prewarmPoolSize = prewarmPoolSize;
        }
    }

    public static class Hierarchy {
        private boolean writeBack = false;
        private int writeBackBatchSize = 500;

        public boolean isWriteBack() {
            return writeBack;
        }

        public void setWriteBack(boolean writeBack) {
            this.writeBack = writeBack;
        }

        public int getWriteBackBatchSize() {
            return writeBackBatchSize;
        }

        public void setWriteBackBatchSize(int writeBackBatchSize) {
            this.writeBackBatchSize = writeBackBatchSize;
        }
    }
}
