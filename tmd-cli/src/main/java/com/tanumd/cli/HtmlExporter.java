package com.tanumd.cli;

import com.tanumd.core.document.TmdDocument;
import com.tanumd.core.model.AttachmentMeta;
import com.vladsch.flexmark.ast.Image;
import com.vladsch.flexmark.ext.gfm.tasklist.TaskListExtension;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.html.AttributeProvider;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.html.IndependentAttributeProviderFactory;
import com.vladsch.flexmark.html.renderer.AttributablePart;
import com.vladsch.flexmark.html.renderer.LinkResolverContext;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import com.vladsch.flexmark.util.html.MutableAttributes;
import com.vladsch.flexmark.util.sequence.Escaping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Renders a document as a standalone HTML page.
 *
 * <p>Markdown is rendered with flexmark (tables and task lists enabled). The page ends with an
 * attachment section. When self-contained, attachments are embedded as base64 {@code data:}
 * URIs, both in that section and in place of image sources that name an attachment.
 */
public final class HtmlExporter {

    private static final Logger log = LoggerFactory.getLogger(HtmlExporter.class);

    private static final String STYLE = """
              body { font-family: system-ui, sans-serif; margin: 2rem; line-height: 1.6; }
              pre { background: #f5f5f5; padding: 1rem; overflow-x: auto; }
              code { font-family: ui-monospace, Menlo, Consolas, monospace; }
              table { border-collapse: collapse; }
              th, td { border: 1px solid #ccc; padding: 0.25rem 0.5rem; }
        """;

    private final boolean selfContained;

    public HtmlExporter(boolean selfContained) {
        this.selfContained = selfContained;
    }

    /**
     * Renders the page.
     *
     * @param doc document
     * @return HTML text
     */
    public String render(TmdDocument doc) {
        MutableDataSet options = new MutableDataSet();
        options.set(Parser.EXTENSIONS, List.of(TablesExtension.create(), TaskListExtension.create()));
        Parser parser = Parser.builder(options).build();
        HtmlRenderer.Builder builder = HtmlRenderer.builder(options);
        if (selfContained) {
            builder.attributeProviderFactory(new EmbeddedImages(doc));
        }
        String body = builder.build().render(parser.parse(doc.markdown()));

        String title = doc.manifest().title() == null ? "Untitled" : doc.manifest().title();
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n")
            .append("<html lang=\"en\">\n")
            .append("  <head>\n")
            .append("    <meta charset=\"utf-8\" />\n")
            .append("    <title>").append(escape(title)).append("</title>\n")
            .append("    <style>\n").append(STYLE).append("    </style>\n")
            .append("  </head>\n")
            .append("  <body>\n")
            .append("    <article>\n").append(body).append("    </article>\n")
            .append(attachmentSection(doc))
            .append("  </body>\n")
            .append("</html>\n");
        log.debug("Rendered {} characters of HTML (self-contained: {})", html.length(), selfContained);
        return html.toString();
    }

    private String attachmentSection(TmdDocument doc) {
        List<AttachmentMeta> attachments = doc.attachments();
        if (attachments.isEmpty()) {
            return "";
        }
        StringBuilder section = new StringBuilder("    <section><h2>Attachments</h2><ul>\n");
        for (AttachmentMeta meta : attachments) {
            String name = escape(meta.logicalPath());
            if (selfContained) {
                section.append("      <li><a download=\"").append(name).append("\" href=\"")
                    .append(dataUri(doc, meta)).append("\">").append(name).append("</a> (")
                    .append(meta.length()).append(" bytes)</li>\n");
            } else {
                section.append("      <li><code>").append(name).append("</code> (")
                    .append(meta.length()).append(" bytes, ").append(escape(meta.mime())).append(")</li>\n");
            }
        }
        return section.append("    </ul></section>\n").toString();
    }

    static String dataUri(TmdDocument doc, AttachmentMeta meta) {
        ByteBuffer data = doc.attachmentData(meta.id()).orElseThrow();
        ByteBuffer encoded = Base64.getEncoder().encode(data);
        byte[] ascii = new byte[encoded.remaining()];
        encoded.get(ascii);
        return "data:" + meta.mime() + ";base64," + new String(ascii, StandardCharsets.US_ASCII);
    }

    private static String escape(String text) {
        return Escaping.escapeHtml(text, false);
    }

    /**
     * Replaces image sources that resolve to attachments with data URIs.
     */
    private static final class EmbeddedImages extends IndependentAttributeProviderFactory {

        private final TmdDocument doc;

        private EmbeddedImages(TmdDocument doc) {
            this.doc = doc;
        }

        @Override
        public AttributeProvider apply(LinkResolverContext context) {
            return this::embed;
        }

        private void embed(Node node, AttributablePart part, MutableAttributes attributes) {
            if (!(node instanceof Image image)) {
                return;
            }
            Optional<AttachmentMeta> meta = doc.attachmentByPath(image.getUrl().toString());
            meta.ifPresent(found -> attributes.replaceValue("src", dataUri(doc, found)));
        }
    }
}
