package difftree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

public class PropertiesConfigProvider implements ConfigProvider {

    private static final String DIFFTREE_CONFIG_FILE = "difftree.config";
    private static final String CONFIG_DISPLAY_MODE = "display.mode";
    private static final String CONFIG_SORT_COLUMN = "sort.column";
    private static final String CONFIG_SORT_ORDER = "sort.order";
    private static final String CONFIG_FOLDERS_ON_TOP = "folders.on.top";
    private static final String CONFIG_JSON_LINES = "json.lines";
    private final Logger logger = LoggerFactory.getLogger("difftree");

    private DisplayMode displayMode = DisplayMode.TREE;
    private SortColumn sortColumn = SortColumn.NAME;
    private boolean sortAscending = true;
    private boolean foldersOnTop;
    private boolean jsonLines;

    public PropertiesConfigProvider() throws IOException {
        this(Path.of(System.getProperty("user.home"), DIFFTREE_CONFIG_FILE));
    }

    public PropertiesConfigProvider(Path configFile) throws IOException {
        readConfigFile(configFile);
    }

    private void readConfigFile(Path configFile) throws IOException {
        if (!Files.isReadable(configFile)) {
            logger.info("{} not found or can't be read ... using defaults", configFile);
            return;
        }
        logger.info("Start reading config file {}", configFile);
        Properties properties = new Properties();
        try (InputStream inputStream = Files.newInputStream(configFile)) {
            properties.load(inputStream);
        }
        displayMode = readEnum(properties, CONFIG_DISPLAY_MODE, DisplayMode.class, displayMode);
        sortColumn = readEnum(properties, CONFIG_SORT_COLUMN, SortColumn.class, sortColumn);
        String sortOrder = properties.getProperty(CONFIG_SORT_ORDER);
        if (sortOrder != null) {
            switch (sortOrder.trim().toUpperCase(Locale.ROOT)) {
                case "ASC" -> sortAscending = true;
                case "DESC" -> sortAscending = false;
                default -> {
                    logger.error("Invalid config: {} expected to be ASC or DESC but was '{}'", CONFIG_SORT_ORDER, sortOrder);
                    throw new RuntimeException("Invalid config");
                }
            }
        }
        foldersOnTop = readBoolean(properties, CONFIG_FOLDERS_ON_TOP, foldersOnTop);
        jsonLines = readBoolean(properties, CONFIG_JSON_LINES, jsonLines);
        logger.info("Using display mode {}, sorted by {} {}", displayMode, sortColumn, sortAscending ? "ascending" : "descending");
    }

    private <E extends Enum<E>> E readEnum(Properties properties, String key, Class<E> type, E defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.error("Invalid config: {} has unknown value '{}'", key, value);
            throw new RuntimeException("Invalid config");
        }
    }

    private boolean readBoolean(Properties properties, String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        value = value.trim();
        if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
            logger.error("Invalid config: {} expected to be true or false but was '{}'", key, value);
            throw new RuntimeException("Invalid config");
        }
        return Boolean.parseBoolean(value);
    }

    @Override
    public DisplayMode getDisplayMode() {
        return displayMode;
    }

    @Override
    public SortColumn getSortColumn() {
        return sortColumn;
    }

    @Override
    public boolean isSortAscending() {
        return sortAscending;
    }

    @Override
    public boolean isFoldersOnTop() {
        return foldersOnTop;
    }

    @Override
    public boolean isJsonLines() {
        return jsonLines;
    }
}
