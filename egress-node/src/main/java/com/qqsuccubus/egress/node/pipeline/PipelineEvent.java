package com.qqsuccubus.egress.node.pipeline;

import lombok.Value;

/**
 * Lifecycle report emitted by a running pipeline.
 */
@Value
public class PipelineEvent {

    public enum Type {
        /**
         * Pipeline is up and producing output.
         */
        ACTIVE,

        /**
         * Output finalized.
         */
        COMPLETE,

        /**
         * Pipeline failed, {@link #getError()} has the detail.
         */
        FAILED
    }

    Type type;
    String error;

    public static PipelineEvent active() {
        return new PipelineEvent(Type.ACTIVE, "");
    }

    public static PipelineEvent complete() {
        return new PipelineEvent(Type.COMPLETE, "");
    }

    public static PipelineEvent failed(String error) {
        return new PipelineEvent(Type.FAILED, error == null ? "" : error);
    }
}
