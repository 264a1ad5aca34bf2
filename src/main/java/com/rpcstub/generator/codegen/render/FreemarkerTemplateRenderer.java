package com.rpcstub.generator.codegen.render;

import com.rpcstub.generator.codegen.exception.RenderException;
import com.rpcstub.generator.codegen.exception.TypeClassificationException;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;

/**
 * FreeMarker-backed renderer. Templates live on the classpath under {@code /templates}
 * as {@code <name>.ftl}; shared sub-templates are macros imported from there.
 */
public class FreemarkerTemplateRenderer implements TemplateRenderer {

    private static final Logger log = LoggerFactory.getLogger(FreemarkerTemplateRenderer.class);

    public static final String DEFAULT_TEMPLATE_PATH = "/templates";

    private final Configuration freemarkerConfig;

    public FreemarkerTemplateRenderer() {
        this(DEFAULT_TEMPLATE_PATH);
    }

    public FreemarkerTemplateRenderer(String templatePath) {
        this.freemarkerConfig = createFreemarkerConfig(templatePath);
    }

    private Configuration createFreemarkerConfig(String templatePath) {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), templatePath);
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * Loads every known template once so a broken template fails before any document is processed.
     */
    @Override
    public void preload() throws RenderException {
        for (String name : new String[] {FILE_TEMPLATE, PROTECTION_TEMPLATE}) {
            try {
                freemarkerConfig.getTemplate(name + ".ftl");
            } catch (IOException e) {
                throw new RenderException("cannot load template " + name + ": " + e.getMessage(), e);
            }
        }
    }

    @Override
    public String render(String templateName, Object model) throws RenderException, TypeClassificationException {
        StringWriter out = new StringWriter();
        try {
            Template template = freemarkerConfig.getTemplate(templateName + ".ftl");
            template.process(model, out);
        } catch (IOException e) {
            throw new RenderException("cannot load template " + templateName + ": " + e.getMessage(), e);
        } catch (TemplateException e) {
            TypeClassificationException classification = findClassificationCause(e);
            if (classification != null) {
                throw classification;
            }
            log.debug("Template {} failed", templateName, e);
            throw new RenderException("execute template " + templateName + ": " + e.getMessage(), e);
        }
        return out.toString();
    }

    private static TypeClassificationException findClassificationCause(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < 16; depth++) {
            if (current instanceof TypeClassificationException) {
                return (TypeClassificationException) current;
            }
            current = current.getCause();
        }
        return null;
    }
}
