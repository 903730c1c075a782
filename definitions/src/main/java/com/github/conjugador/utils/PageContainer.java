package com.github.conjugador.utils;

import java.util.Objects;

public class PageContainer {
    protected String title;
    protected String text;

    public PageContainer(String title, String text) {
        this.title = Objects.requireNonNull(title);
        this.text = Objects.requireNonNull(text);
    }

    public String getTitle() {
        return title;
    }

    public String getText() {
        return text;
    }

    public String toString() {
        return String.format("%s = %s", title, text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, text);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        } else if (obj instanceof PageContainer pc) {
            return title.equals(pc.title) && text.equals(pc.text);
        } else {
            return false;
        }
    }
}
