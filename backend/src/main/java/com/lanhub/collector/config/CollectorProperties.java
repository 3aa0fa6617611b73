package com.lanhub.collector.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "collector")
public class CollectorProperties {
    private static final String DEFAULT_ROOT = "./data/collect";
    private static final String DEFAULT_EXTENSION = ".csv";
    private static final String DEFAULT_SEPARATOR = "|";
    private static final String DEFAULT_GROUP_BY_FIELD = "所属部门";

    private Storage storage = new Storage();
    private Merge merge = new Merge();
    private Tasks tasks = new Tasks();
    private Cli cli = new Cli();

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Merge getMerge() {
        return merge;
    }

    public void setMerge(Merge merge) {
        this.merge = merge;
    }

    public Tasks getTasks() {
        return tasks;
    }

    public void setTasks(Tasks tasks) {
        this.tasks = tasks;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    static String normalizeExtension(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_EXTENSION;
        }
        String trimmed = candidate.trim();
        return trimmed.startsWith(".") ? trimmed : "." + trimmed;
    }

    public static class Storage {
        private String root = DEFAULT_ROOT;
        private String defaultExtension = DEFAULT_EXTENSION;
        private long maxFileSizeBytes = 50L * 1024 * 1024;
        private List<String> allowedExtensions = new ArrayList<>(List.of(DEFAULT_EXTENSION));

        public String getRoot() {
            return root == null || root.isBlank() ? DEFAULT_ROOT : root.trim();
        }

        public void setRoot(String root) {
            this.root = root;
        }

        public String getDefaultExtension() {
            return normalizeExtension(defaultExtension);
        }

        public void setDefaultExtension(String defaultExtension) {
            this.defaultExtension = defaultExtension;
        }

        public long getMaxFileSizeBytes() {
            return Math.max(1, maxFileSizeBytes);
        }

        public void setMaxFileSizeBytes(long maxFileSizeBytes) {
            this.maxFileSizeBytes = maxFileSizeBytes;
        }

        public List<String> getAllowedExtensions() {
            List<String> normalized = new ArrayList<>();
            if (allowedExtensions != null) {
                for (String candidate : allowedExtensions) {
                    if (candidate != null && !candidate.isBlank()) {
                        normalized.add(normalizeExtension(candidate).toLowerCase(Locale.ROOT));
                    }
                }
            }
            return normalized.isEmpty() ? List.of(DEFAULT_EXTENSION) : normalized;
        }

        public void setAllowedExtensions(List<String> allowedExtensions) {
            this.allowedExtensions = allowedExtensions;
        }
    }

    public static class Merge {
        private String separator = DEFAULT_SEPARATOR;
        private int headerRowIndex = 0;
        private String tabularExtension = DEFAULT_EXTENSION;
        private String defaultGroupByField = DEFAULT_GROUP_BY_FIELD;

        public String getSeparator() {
            return separator == null || separator.isEmpty() ? DEFAULT_SEPARATOR : separator;
        }

        public void setSeparator(String separator) {
            this.separator = separator;
        }

        public int getHeaderRowIndex() {
            return Math.max(0, headerRowIndex);
        }

        public void setHeaderRowIndex(int headerRowIndex) {
            this.headerRowIndex = Math.max(0, headerRowIndex);
        }

        public String getTabularExtension() {
            return normalizeExtension(tabularExtension);
        }

        public void setTabularExtension(String tabularExtension) {
            this.tabularExtension = tabularExtension;
        }

        public String getDefaultGroupByField() {
            return defaultGroupByField == null || defaultGroupByField.isBlank()
                ? DEFAULT_GROUP_BY_FIELD
                : defaultGroupByField.trim();
        }

        public void setDefaultGroupByField(String defaultGroupByField) {
            this.defaultGroupByField = defaultGroupByField;
        }
    }

    public static class Tasks {
        private int slugLength = 14;
        private int slugMaxRetries = 5;

        public int getSlugLength() {
            return Math.max(6, slugLength);
        }

        public void setSlugLength(int slugLength) {
            this.slugLength = slugLength;
        }

        public int getSlugMaxRetries() {
            return Math.max(1, slugMaxRetries);
        }

        public void setSlugMaxRetries(int slugMaxRetries) {
            this.slugMaxRetries = Math.max(1, slugMaxRetries);
        }
    }

    public static class Cli {
        private boolean run = false;
        private String taskSlug = "";
        private String output = "";
        private String dedupColumns = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getTaskSlug() {
            return taskSlug;
        }

        public void setTaskSlug(String taskSlug) {
            this.taskSlug = taskSlug;
        }

        public String getOutput() {
            return output;
        }

        public void setOutput(String output) {
            this.output = output;
        }

        public String getDedupColumns() {
            return dedupColumns == null ? "" : dedupColumns;
        }

        public void setDedupColumns(String dedupColumns) {
            this.dedupColumns = dedupColumns;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
