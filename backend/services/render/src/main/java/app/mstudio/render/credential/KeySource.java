package app.mstudio.render.credential;

public enum KeySource {
    user,
    platform
}
