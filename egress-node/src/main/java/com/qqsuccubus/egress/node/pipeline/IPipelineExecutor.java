package com.qqsuccubus.egress.node.pipeline;

import com.qqsuccubus.egress.core.msg.StartEgressRequest;

/**
 * Builds and runs the media pipeline of an accepted egress request.
 * <p>
 * Implementations must return without waiting for the pipeline; everything that happens
 * afterwards is reported through {@link PipelineHandle#events()}.
 * </p>
 */
public interface IPipelineExecutor {

    PipelineHandle launch(String egressId, StartEgressRequest request);
}
