package in.tradecore.domain.monitoring;

public enum EngineState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING
}
