package app.mstudio.render.domain.type;

public enum CredentialStatus {
    connected,
    disconnected,
    error
}
