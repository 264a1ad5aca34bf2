package com.rpcstub.generator.codegen.render;

import com.rpcstub.generator.codegen.exception.RenderException;
import com.rpcstub.generator.codegen.exception.TypeClassificationException;

/**
 * Renders a named template against a data model.
 */
public interface TemplateRenderer {

    String FILE_TEMPLATE = "file";
    String PROTECTION_TEMPLATE = "protection";

    /**
     * @throws TypeClassificationException when a template helper failed to classify a type
     * @throws RenderException for any other template failure
     */
    String render(String templateName, Object model) throws RenderException, TypeClassificationException;

    /**
     * Prepares every template before the first document is rendered.
     */
    default void preload() throws RenderException {
    }
}
