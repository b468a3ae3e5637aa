package com.github.hycon.xml;

import org.jetbrains.annotations.NotNull;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Converts objects of one type to and from a single XML element.
 */
public interface XmlSerializer<T> {

    /**
     * Create an element of {@code document} describing the item. The element is not attached
     * anywhere, the caller decides where it goes.
     */
    @NotNull
    Element write(@NotNull Document document, @NotNull T item);

    @NotNull
    T read(@NotNull Element element) throws FormatException;

}
