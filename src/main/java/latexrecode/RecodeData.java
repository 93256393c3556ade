package latexrecode;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.Normalizer;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The parsed recode data set: every macro definition in document order, plus the
 * characters excluded from each direction.
 *
 * <p>This class supports loading from:
 * <ul>
 *     <li>the {@code <texmap>} XML form (bundled as {@code /recode/recode_data.xml})</li>
 *     <li>a JSON-serialized form produced by {@link #serializeToJson(Path)}</li>
 * </ul>
 *
 * <p>The XML layout groups definitions by category and set membership:</p>
 * <pre>{@code
 * <texmap>
 *   <maps type="letters" set="base, full">
 *     <map><from>ss</from><to>ß</to></map>
 *     <map><from preferred="1" raw="1">--</from><to>–</to></map>
 *   </maps>
 *   <decode_exclude><char>textbackslash</char></decode_exclude>
 *   <encode_exclude><char>\</char></encode_exclude>
 * </texmap>
 * }</pre>
 */
public final class RecodeData {
    private static final Logger LOGGER = Logger.getLogger(RecodeData.class.getName());

    /**
     * Classpath location of the bundled data file.
     */
    public static final String DEFAULT_RESOURCE = "/recode/recode_data.xml";

    private final List<MacroDefinition> definitions;
    private final Set<String> decodeExclude;
    private final Set<String> encodeExclude;

    /**
     * Creates a data set. Exclusion entries are NFD-normalized.
     *
     * @param definitions   macro definitions in document order
     * @param decodeExclude macro names never decoded
     * @param encodeExclude glyphs never encoded
     */
    @JsonCreator
    public RecodeData(@JsonProperty("definitions") List<MacroDefinition> definitions,
                      @JsonProperty("decodeExclude") Collection<String> decodeExclude,
                      @JsonProperty("encodeExclude") Collection<String> encodeExclude) {
        this.definitions = definitions == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(definitions));
        this.decodeExclude = nfdSet(decodeExclude);
        this.encodeExclude = nfdSet(encodeExclude);
    }

    private static Set<String> nfdSet(Collection<String> chars) {
        if (chars == null) return Collections.emptySet();
        Set<String> out = new LinkedHashSet<>();
        for (String c : chars) {
            if (c != null) out.add(Normalizer.normalize(c, Normalizer.Form.NFD));
        }
        return Collections.unmodifiableSet(out);
    }

    @JsonProperty("definitions")
    public List<MacroDefinition> getDefinitions() {
        return definitions;
    }

    @JsonProperty("decodeExclude")
    public Set<String> getDecodeExclude() {
        return decodeExclude;
    }

    @JsonProperty("encodeExclude")
    public Set<String> getEncodeExclude() {
        return encodeExclude;
    }

    /**
     * Whether the data set holds no definitions at all.
     *
     * @return {@code true} if there are no definitions
     */
    @JsonIgnore
    public boolean isEmpty() {
        return definitions.isEmpty();
    }

    /**
     * Returns the set identifiers used anywhere in this data, in first-seen order.
     *
     * @return the distinct set identifiers
     */
    public Set<String> setIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (MacroDefinition d : definitions) {
            ids.addAll(d.getSets());
        }
        return ids;
    }

    @Override
    public String toString() {
        return "<RecodeData with " + definitions.size() + " definitions, sets " + setIds() + ">";
    }

    // ---------------------------------------------------------------- loading

    /**
     * Lazily loaded, shared copy of the bundled data set.
     *
     * <p>The data is read from {@code recode/recode_data.xml} in the working
     * directory if that file exists, otherwise from {@link #DEFAULT_RESOURCE} on the
     * classpath. Loading happens once per JVM on first access.</p>
     */
    public static final class DataHolder {
        private DataHolder() {
        }

        private static class Holder {
            private static final RecodeData DEFAULT = load();
        }

        /**
         * Returns the shared bundled data set.
         *
         * @return the shared instance
         * @throws RecodeDataException if no data source can be loaded
         */
        public static RecodeData get() {
            return Holder.DEFAULT;
        }

        private static RecodeData load() {
            Path xmlPath = Paths.get("recode", "recode_data.xml");
            if (Files.exists(xmlPath)) {
                LOGGER.info("Using recode data file " + xmlPath.toAbsolutePath());
                return fromXml(xmlPath);
            }
            try (InputStream in = RecodeData.class.getResourceAsStream(DEFAULT_RESOURCE)) {
                if (in == null) {
                    throw new RecodeDataException("Missing resource: " + DEFAULT_RESOURCE
                            + " (also checked FS: " + xmlPath.toAbsolutePath() + ")");
                }
                return fromXml(in);
            } catch (IOException e) {
                throw new RecodeDataException("Failed to load recode data", e);
            }
        }
    }

    /**
     * Loads a data file, choosing the parser by extension: {@code .json} files are
     * read as JSON, anything else as {@code <texmap>} XML.
     *
     * @param path the data file
     * @return the parsed data set
     * @throws RecodeDataException if the file cannot be read or parsed
     */
    public static RecodeData fromFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") ? fromJson(path) : fromXml(path);
    }

    /**
     * Loads a {@code <texmap>} XML file.
     *
     * @param path the XML file
     * @return the parsed data set
     * @throws RecodeDataException if the file cannot be read or parsed
     */
    public static RecodeData fromXml(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return fromXml(in);
        } catch (IOException e) {
            throw new RecodeDataException("Can't read recode data file " + path, e);
        }
    }

    /**
     * Parses {@code <texmap>} XML from a stream. The stream is not closed.
     *
     * <p>A {@code <maps>} element with an unknown {@code type} still yields its
     * definitions, with a {@code null} category; the table builder rejects them
     * individually.</p>
     *
     * @param in UTF-8 XML content
     * @return the parsed data set
     * @throws RecodeDataException if the XML is not well formed
     */
    public static RecodeData fromXml(InputStream in) {
        XMLInputFactory factory = XMLInputFactory.newInstance();
        trySet(factory, XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        trySet(factory, XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);

        List<MacroDefinition> definitions = new ArrayList<>();
        List<String> decodeExclude = new ArrayList<>();
        List<String> encodeExclude = new ArrayList<>();

        RecodeCategory category = null;
        List<String> sets = Collections.emptyList();
        List<String> exclude = null;

        String from = null;
        String to = null;
        boolean preferred = false;
        boolean raw = false;

        try {
            XMLStreamReader r = factory.createXMLStreamReader(in, StandardCharsets.UTF_8.name());
            try {
                while (r.hasNext()) {
                    int ev = r.next();

                    if (ev == XMLStreamConstants.START_ELEMENT) {
                        String local = r.getLocalName();
                        switch (local) {
                            case "maps": {
                                String type = r.getAttributeValue(null, "type");
                                category = RecodeCategory.tryParse(type);
                                if (category == null) {
                                    LOGGER.warning("Unknown maps type '" + type + "' in recode data");
                                }
                                sets = splitSets(r.getAttributeValue(null, "set"));
                                break;
                            }
                            case "map":
                                from = null;
                                to = null;
                                preferred = false;
                                raw = false;
                                break;
                            case "from":
                                preferred = r.getAttributeValue(null, "preferred") != null;
                                raw = r.getAttributeValue(null, "raw") != null;
                                from = r.getElementText();
                                break;
                            case "to":
                                to = r.getElementText();
                                break;
                            case "decode_exclude":
                                exclude = decodeExclude;
                                break;
                            case "encode_exclude":
                                exclude = encodeExclude;
                                break;
                            case "char":
                                String c = r.getElementText();
                                if (exclude != null) exclude.add(c);
                                break;
                            default:
                                break;
                        }

                    } else if (ev == XMLStreamConstants.END_ELEMENT) {
                        String local = r.getLocalName();
                        if ("map".equals(local)) {
                            definitions.add(new MacroDefinition(category, from, to, preferred, raw, sets));
                        } else if ("maps".equals(local)) {
                            category = null;
                            sets = Collections.emptyList();
                        } else if ("decode_exclude".equals(local) || "encode_exclude".equals(local)) {
                            exclude = null;
                        }
                    }
                }
            } finally {
                r.close();
            }
        } catch (XMLStreamException e) {
            throw new RecodeDataException("Malformed recode data XML", e);
        }

        RecodeData data = new RecodeData(definitions, decodeExclude, encodeExclude);
        LOGGER.fine(() -> "Loaded " + data);
        return data;
    }

    private static List<String> splitSets(String attr) {
        if (attr == null || attr.trim().isEmpty()) return Collections.emptyList();
        List<String> out = new ArrayList<>();
        for (String s : attr.split("\\s*,\\s*")) {
            String t = s.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static void trySet(XMLInputFactory f, String key, Object value) {
        try {
            f.setProperty(key, value);
        } catch (IllegalArgumentException e) {
            LOGGER.log(Level.FINE, "XMLInputFactory does not support " + key, e);
        }
    }

    /**
     * Loads a JSON data file written by {@link #serializeToJson(Path)}.
     *
     * @param path the JSON file
     * @return the parsed data set
     * @throws RecodeDataException if the file cannot be read or parsed
     */
    public static RecodeData fromJson(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(in);
        } catch (IOException e) {
            throw new RecodeDataException("Can't read recode data file " + path, e);
        }
    }

    /**
     * Parses the JSON form from a stream.
     *
     * @param in the JSON content
     * @return the parsed data set
     * @throws RecodeDataException if the JSON cannot be read or mapped
     */
    public static RecodeData fromJson(InputStream in) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            return mapper.readValue(in, RecodeData.class);
        } catch (IOException e) {
            throw new RecodeDataException("Malformed recode data JSON", e);
        }
    }

    /**
     * Serializes this data set to a pretty-printed UTF-8 JSON file.
     *
     * @param outputPath where to write the JSON
     * @throws RecodeDataException if writing the file fails
     */
    public void serializeToJson(Path outputPath) {
        ObjectMapper mapper = new ObjectMapper();
        try (Writer writer = new OutputStreamWriter(Files.newOutputStream(outputPath), StandardCharsets.UTF_8)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(writer, this);
        } catch (IOException e) {
            throw new RecodeDataException("Failed to write JSON to: " + outputPath, e);
        }
    }
}
