package app.mstudio.render.dispatch;

public enum DispatchMode {
    SUBSTRATE,
    DIRECT
}
