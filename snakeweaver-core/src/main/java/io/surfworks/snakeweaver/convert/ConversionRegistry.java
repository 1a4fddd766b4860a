package io.surfworks.snakeweaver.convert;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import io.surfworks.snakeweaver.ast.AgAst.FunctionDef;
import io.surfworks.snakeweaver.ast.AgAst.Stmt;
import io.surfworks.snakeweaver.convert.ControlFlowTransformer.BlockPlan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Conversion state of every function seen by the engine.
 *
 * <p>Functions are registered once and referred to by the {@link CallableHandle}
 * issued at registration. Records are never removed.
 */
public final class ConversionRegistry {

    private static final Logger LOGGER = Logger.getLogger(ConversionRegistry.class.getName());

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .create();

    private static final ConversionRegistry GLOBAL = new ConversionRegistry();

    private final Map<FunctionDef, CallableHandle> handles = new IdentityHashMap<>();
    private final Map<CallableHandle, ConversionRecord> records = new LinkedHashMap<>();
    private long nextId = 1;

    /**
     * The process-wide registry.
     */
    public static ConversionRegistry global() {
        return GLOBAL;
    }

    /**
     * Returns the function's handle, issuing one on first registration.
     */
    public synchronized CallableHandle register(FunctionDef function) {
        CallableHandle handle = handles.get(function);
        if (handle == null) {
            handle = new CallableHandle(nextId++, function.name());
            handles.put(function, handle);
            LOGGER.fine("Registered " + handle);
        }
        return handle;
    }

    public synchronized Optional<CallableHandle> handleOf(FunctionDef function) {
        return Optional.ofNullable(handles.get(function));
    }

    /**
     * Record for the handle, created on the first call. Every call counts as an attempt.
     */
    public synchronized ConversionRecord recordAttempt(CallableHandle handle) {
        ConversionRecord record = records.computeIfAbsent(handle, ConversionRecord::new);
        record.beginAttempt();
        return record;
    }

    public synchronized Optional<ConversionRecord> record(CallableHandle handle) {
        return Optional.ofNullable(records.get(handle));
    }

    public synchronized void markConverted(CallableHandle handle, String convertedSource) {
        markConverted(handle, convertedSource, Map.of());
    }

    synchronized void markConverted(CallableHandle handle, String convertedSource, Map<Stmt, BlockPlan> plans) {
        require(handle).succeed(convertedSource, Collections.unmodifiableMap(new IdentityHashMap<>(plans)));
        LOGGER.fine("Converted " + handle);
    }

    public synchronized void markFailed(CallableHandle handle, String reason) {
        require(handle).fail(reason);
        LOGGER.fine("Conversion of " + handle + " failed: " + reason);
    }

    public synchronized boolean isConverted(CallableHandle handle) {
        ConversionRecord record = records.get(handle);
        return record != null && record.isConverted();
    }

    /**
     * @throws NotConvertedException      if conversion was never attempted
     * @throws ConversionFailedException  if the last attempt failed
     */
    public synchronized String getConvertedSource(CallableHandle handle) {
        ConversionRecord record = records.get(handle);
        if (record == null) {
            throw new NotConvertedException(handle.name(), handle);
        }
        if (!record.isConverted()) {
            throw new ConversionFailedException(handle, record.failureReason());
        }
        return record.convertedSource();
    }

    public synchronized List<ConversionRecord> records() {
        return new ArrayList<>(records.values());
    }

    /**
     * Snapshot of every record as pretty-printed JSON.
     */
    public synchronized String toJson() {
        JsonArray array = new JsonArray();
        for (ConversionRecord record : records.values()) {
            JsonObject json = new JsonObject();
            json.addProperty("handle", record.handle().id());
            json.addProperty("function", record.functionName());
            json.addProperty("converted", record.isConverted());
            json.addProperty("attempts", record.attempts());
            json.addProperty("failureReason", record.failureReason());
            json.addProperty("convertedSource", record.convertedSource());
            array.add(json);
        }
        JsonObject root = new JsonObject();
        root.add("records", array);
        return GSON.toJson(root);
    }

    private ConversionRecord require(CallableHandle handle) {
        ConversionRecord record = records.get(handle);
        if (record == null) {
            throw new NotConvertedException(handle.name(), handle);
        }
        return record;
    }
}
