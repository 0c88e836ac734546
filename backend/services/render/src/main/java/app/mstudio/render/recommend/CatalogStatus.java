package app.mstudio.render.recommend;

public enum CatalogStatus {
    active,
    coming_soon,
    deprecated
}
