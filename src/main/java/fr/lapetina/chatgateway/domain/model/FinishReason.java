package fr.lapetina.chatgateway.domain.model;

/**
 * Why a completion ended, with its wire value.
 */
public enum FinishReason {
    STOP("stop"),
    ERROR("error");

    private final String wireValue;

    FinishReason(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }
}
