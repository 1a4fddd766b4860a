package io.surfworks.snakeweaver.convert;

import io.surfworks.snakeweaver.ast.AgAst.Stmt;
import io.surfworks.snakeweaver.convert.ControlFlowTransformer.BlockPlan;

import java.util.Map;

/**
 * Conversion state of one registered function. Created on the first attempt, updated on retries.
 */
public final class ConversionRecord {

    private final CallableHandle handle;
    private final String functionName;
    private boolean converted;
    private String convertedSource;
    private String failureReason;
    private int attempts;
    private Map<Stmt, BlockPlan> plans = Map.of();

    ConversionRecord(CallableHandle handle) {
        this.handle = handle;
        this.functionName = handle.name();
    }

    public CallableHandle handle() {
        return handle;
    }

    public String functionName() {
        return functionName;
    }

    public boolean isConverted() {
        return converted;
    }

    /**
     * Converted source text, or null if conversion has not succeeded.
     */
    public String convertedSource() {
        return convertedSource;
    }

    /**
     * Message of the last failed attempt, or null.
     */
    public String failureReason() {
        return failureReason;
    }

    public int attempts() {
        return attempts;
    }

    /**
     * Block plans of the successful conversion, keyed by statement identity.
     */
    Map<Stmt, BlockPlan> plans() {
        return plans;
    }

    void beginAttempt() {
        attempts++;
    }

    void succeed(String source, Map<Stmt, BlockPlan> plans) {
        converted = true;
        convertedSource = source;
        failureReason = null;
        this.plans = plans;
    }

    void fail(String reason) {
        converted = false;
        convertedSource = null;
        failureReason = reason;
        plans = Map.of();
    }

    @Override
    public String toString() {
        return "ConversionRecord[" + handle + ", converted=" + converted + ", attempts=" + attempts + "]";
    }
}
