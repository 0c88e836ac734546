package app.mstudio.render.credential;

public record ResolvedCredential(String apiKey, KeySource source) {

    @Override
    public String toString() {
        return "ResolvedCredential[source=" + source + ", apiKey=****]";
    }
}
