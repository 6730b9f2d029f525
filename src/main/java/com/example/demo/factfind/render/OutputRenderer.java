package com.example.demo.factfind.render;

import com.example.demo.factfind.aspect.LogExecutionTime;
import com.example.demo.factfind.model.GenerationResult;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.data.MutableDataSet;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders a generation result as HTML restricted to a small allow-list.
 *
 * <p>Raw HTML from the service is cleaned directly. Markdown (or the plain {@code response}
 * text) is converted first, with GFM tables and single newlines rendered as line breaks.
 * Disallowed elements and attributes are removed, not escaped; the text inside a removed
 * element is kept unless the element is a script or style block.
 */
@Slf4j
@Component
public class OutputRenderer {
    static final String[] ALLOWED_TAGS = {
            "h1", "h2", "h3", "h4", "p", "br", "hr", "strong", "em", "code",
            "ul", "ol", "li", "blockquote", "table", "thead", "tbody", "tr", "th", "td"
    };

    private final Parser parser;
    private final HtmlRenderer renderer;
    private final Safelist safelist;
    private final Document.OutputSettings outputSettings = new Document.OutputSettings().prettyPrint(false);

    public OutputRenderer() {
        MutableDataSet options = new MutableDataSet();
        options.set(Parser.EXTENSIONS, List.of(TablesExtension.create()));
        options.set(HtmlRenderer.SOFT_BREAK, "<br />\n");
        parser = Parser.builder(options).build();
        renderer = HtmlRenderer.builder(options).build();

        safelist = Safelist.none()
                .addTags(ALLOWED_TAGS)
                .addAttributes("th", "colspan", "rowspan", "align")
                .addAttributes("td", "colspan", "rowspan", "align");
    }

    @LogExecutionTime("Rendering generation result")
    public SafeHtml render(GenerationResult result) {
        if (result == null) {
            return SafeHtml.empty();
        }
        if (result.hasHtml()) {
            return new SafeHtml(sanitizeHtml(result.getResponseHtml()));
        }
        String markdown = result.getMarkdownText();
        if (markdown == null || markdown.isEmpty()) {
            log.debug("Generation result carries neither HTML nor markdown");
            return SafeHtml.empty();
        }
        return new SafeHtml(sanitizeHtml(markdownToHtml(markdown)));
    }

    public String sanitizeHtml(String html) {
        if (html == null || html.isEmpty()) return "";
        return Jsoup.clean(html, "", safelist, outputSettings);
    }

    public String markdownToHtml(String markdown) {
        String normalized = markdown.replace("\r\n", "\n").replace('\r', '\n');
        return renderer.render(parser.parse(normalized));
    }
}
