package fr.lapetina.embedding.accelerator.domain.exception;

import fr.lapetina.embedding.accelerator.domain.model.ErrorType;

/**
 * Thrown when the embedding backend fails or is being shielded by an open circuit.
 */
public final class BackendUnavailableException extends AcceleratorException {

    private final String backendName;

    public BackendUnavailableException(String backendName, String message) {
        super(ErrorType.BACKEND_UNAVAILABLE, "Backend " + backendName + " unavailable: " + message);
        this.backendName = backendName;
    }

    public BackendUnavailableException(String backendName, String message, Throwable cause) {
        super(ErrorType.BACKEND_UNAVAILABLE, "Backend " + backendName + " unavailable: " + message, cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
