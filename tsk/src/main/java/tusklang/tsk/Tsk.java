/* This code is part of TuskLang. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package tusklang.tsk;

import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tusklang.base.FileSystem;
import tusklang.fujsen.FujsenDefinition;
import tusklang.fujsen.FujsenEngine;
import tusklang.fujsen.FujsenExecutionException;
import tusklang.lang.Document;
import tusklang.lang.Entry;
import tusklang.lang.Section;
import tusklang.lang.TskFormatException;
import tusklang.lang.parse.Parser;
import tusklang.lang.text.TskWriter;
import tusklang.lang.value.FujsenCode;
import tusklang.lang.value.Value;
import tusklang.lang.value.Values;
import tusklang.shell.ShellStore;
import tusklang.shell.StorageHandle;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for embedders: parsing, rendering, shell storage and FUJSEN execution over one
 * {@link Document}.
 *
 * <p>The static methods are stateless. An instance owns its document and is not thread-safe.
 * FUJSEN execution needs an engine, supplied with {@link #withEngine(FujsenEngine)}; without
 * one the document is data only.</p>
 *
 * <pre>
 * Tsk tsk = Tsk.fromFile(Path.of("app.tsk")).withEngine(new FujsenEngine(evaluator));
 * Value total = tsk.executeFujsen("billing", "total", Map.of("price", NumberValue.of(10)));
 * </pre>
 */
public final class Tsk {
    private static final Logger logger = LoggerFactory.getLogger(Tsk.class);

    /** Key looked up when no key is named for execution. */
    public static final String DEFAULT_FUJSEN_KEY = "fujsen";

    private final Document document;
    private @Nullable FujsenEngine engine;

    public Tsk() {
        this(new Document());
    }

    /**
     * Wraps {@code document}, which is taken over and not copied.
     */
    public Tsk(Document document) {
        this.document = Objects.requireNonNull(document, "document");
    }

    public static Document parse(String text) throws TskFormatException {
        return Parser.parse(text);
    }

    public static Document parseWithComments(String text) throws TskFormatException {
        return Parser.parseWithComments(text);
    }

    public static String stringify(Document document) {
        return TskWriter.stringify(document);
    }

    /**
     * Writes {@code document} as a shell record.
     *
     * @return {@code handle}
     */
    public static StorageHandle save(Document document, StorageHandle handle) throws IOException {
        return ShellStore.save(document, handle);
    }

    /**
     * Reads a shell record.
     *
     * @throws tusklang.shell.CorruptionException         if the record fails validation
     * @throws tusklang.shell.UnsupportedVersionException if its version cannot be read
     */
    public static Document load(StorageHandle handle) throws IOException {
        return ShellStore.loadDocument(handle);
    }

    /**
     * Parses {@code text}, keeping comments so {@link #toString()} writes them back.
     */
    public static Tsk fromString(String text) throws TskFormatException {
        return new Tsk(Parser.parseWithComments(text));
    }

    public static Tsk fromFile(Path path) throws IOException, TskFormatException {
        String text = Files.readString(path, StandardCharsets.UTF_8);
        Tsk tsk = fromString(text);
        logger.debug("Read {} sections from {}", tsk.document.size(), path);
        return tsk;
    }

    public static Tsk fromShell(StorageHandle handle) throws IOException {
        return new Tsk(ShellStore.loadDocument(handle));
    }

    /**
     * Sets the engine used by the execution methods.
     *
     * @return this
     */
    public Tsk withEngine(@Nullable FujsenEngine engine) {
        this.engine = engine;
        return this;
    }

    public Document getDocument() {
        return document;
    }

    /**
     * Writes the document as TSK text. The file is replaced atomically.
     */
    public void toFile(Path path) throws IOException {
        FileSystem.writeAtomically(path, toString().getBytes(StandardCharsets.UTF_8));
        logger.debug("Wrote {} sections to {}", document.size(), path);
    }

    public StorageHandle save(StorageHandle handle) throws IOException {
        return ShellStore.save(document, handle);
    }

    public @Nullable Section getSection(String name) {
        return document.getSection(name);
    }

    public void setSection(Section section) {
        document.setSection(section);
    }

    /**
     * Replaces or adds the section {@code name} with the given values, converted with
     * {@link Values#of(Object)}.
     */
    public void setSection(String name, Map<String, ?> values) {
        Section.Builder builder = Section.builder(name);
        values.forEach((k, v) -> builder.put(k, Values.of(v)));
        document.setSection(builder.build());
    }

    public boolean deleteSection(String name) {
        return document.deleteSection(name);
    }

    public @Nullable Value getValue(String section, String key) {
        return document.getValue(section, key);
    }

    /**
     * Sets a value, creating the section if needed. Plain Java values are converted with
     * {@link Values#of(Object)}.
     *
     * @throws IllegalArgumentException if the value has no TSK representation
     */
    public void setValue(String section, String key, @Nullable Object value) {
        document.setValue(section, key, Values.of(value));
    }

    /**
     * Stores {@code body} as code under {@code key}, reading its signature.
     */
    public void setFujsen(String section, String key, String body) {
        document.setValue(section, key, FujsenCode.of(body));
    }

    /**
     * Runs the code stored under {@link #DEFAULT_FUJSEN_KEY}.
     */
    public Value executeFujsen(String section, Map<String, ? extends Value> context)
        throws FujsenExecutionException {
        return executeFujsen(section, DEFAULT_FUJSEN_KEY, context);
    }

    /**
     * Runs the code stored at {@code section.key} with names bound from {@code context}.
     *
     * @param key the key holding the code, {@link #DEFAULT_FUJSEN_KEY} if blank
     * @throws IllegalStateException    if no engine is set
     * @throws IllegalArgumentException if the key is missing or does not hold code
     * @throws FujsenExecutionException if execution fails
     */
    public Value executeFujsen(String section, @Nullable String key,
                               Map<String, ? extends Value> context)
        throws FujsenExecutionException {
        FujsenDefinition definition = define(section, StringUtils.defaultIfBlank(key,
                                                                             DEFAULT_FUJSEN_KEY));
        return requireEngine().execute(definition, context);
    }

    /**
     * Runs the code at {@code section.key}, binding {@code args} to its declared parameters in
     * order.
     *
     * @throws IllegalArgumentException if the argument count does not match the declared
     *                                  parameters
     */
    public Value callFujsen(String section, String key, @Nullable Object... args)
        throws FujsenExecutionException {
        FujsenDefinition definition = define(section, key);
        List<String> params = definition.parameters();
        if (params.size() != args.length) {
            throw new IllegalArgumentException(
                section + "." + key + " declares " + params.size() + " parameters, got "
                + args.length + " arguments");
        }
        Map<String, Value> context = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            context.put(params.get(i), Values.of(args[i]));
        }
        return requireEngine().execute(definition, context);
    }

    /**
     * Defines every code-valued key of a section, in key order.
     *
     * @return key to definition, empty if the section is missing or holds no code
     */
    public Map<String, FujsenDefinition> getFujsenMap(String section) {
        Section s = document.getSection(section);
        if (s == null) {
            return Map.of();
        }
        FujsenEngine e = requireEngine();
        Map<String, FujsenDefinition> result = new LinkedHashMap<>();
        for (Entry entry : s.entries()) {
            if (entry.value() instanceof FujsenCode) {
                result.put(entry.key(), e.define(entry.value(), entry.key()));
            }
        }
        return result;
    }

    private FujsenDefinition define(String section, String key) {
        Value value = document.getValue(section, key);
        if (value == null) {
            throw new IllegalArgumentException("No value at " + section + "." + key);
        }
        if (!(value instanceof FujsenCode)) {
            throw new IllegalArgumentException(
                section + "." + key + " holds a " + value.type().name().toLowerCase()
                + ", not FUJSEN code");
        }
        return requireEngine().define(value, key);
    }

    private FujsenEngine requireEngine() {
        FujsenEngine e = engine;
        if (e == null) {
            throw new IllegalStateException("No FUJSEN engine configured");
        }
        return e;
    }

    /**
     * The document as TSK text.
     */
    @Override
    public String toString() {
        return TskWriter.stringify(document);
    }
}
