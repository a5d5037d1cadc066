package com.qqsuccubus.egress.node.job;

import com.qqsuccubus.egress.core.model.EgressInfo;
import com.qqsuccubus.egress.core.model.EgressStatus;
import com.qqsuccubus.egress.core.model.RequestKind;
import com.qqsuccubus.egress.core.msg.StartEgressRequest;
import com.qqsuccubus.egress.node.pipeline.PipelineHandle;
import lombok.Getter;

/**
 * One accepted egress request.
 * <p>
 * Lifecycle fields are only written by {@link JobTable} under its lock; readers use the immutable
 * {@link #getInfo()} snapshot, which is replaced on every applied transition.
 * </p>
 */
@Getter
public class Job {
    private final String egressId;
    private final StartEgressRequest request;
    private final RequestKind kind;
    private final long createdAt;

    private volatile EgressInfo info;
    private volatile PipelineHandle pipeline;

    public Job(String egressId, StartEgressRequest request, String nodeId, long createdAt) {
        this.egressId = egressId;
        this.request = request;
        this.kind = request.getKind();
        this.createdAt = createdAt;
        this.info = EgressInfo.builder()
            .egressId(egressId)
            .roomId(request.getRoomId())
            .requestKind(kind)
            .status(EgressStatus.STARTING)
            .error("")
            .nodeId(nodeId)
            .build();
    }

    public EgressStatus getStatus() {
        return info.getStatus();
    }

    void setInfo(EgressInfo info) {
        this.info = info;
    }

    public void attachPipeline(PipelineHandle pipeline) {
        this.pipeline = pipeline;
    }
}
