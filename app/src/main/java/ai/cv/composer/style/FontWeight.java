package ai.cv.composer.style;

public enum FontWeight {
    NORMAL,
    BOLD
}
