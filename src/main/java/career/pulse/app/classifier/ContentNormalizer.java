package career.pulse.app.classifier;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Turns a message body into plain text. Markup is stripped and entities decoded;
 * line structure is kept so line-oriented patterns ("Location: ...") still work.
 * Non-ASCII characters pass through untouched.
 */
@Component
public class ContentNormalizer {
    private static final Pattern MARKUP = Pattern.compile("(?i)</?[a-z][a-z0-9]*(\\s[^<>]*)?/?>|&(?:[a-z]+|#\\d+|#x[0-9a-f]+);");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\u00A0\\x0B\\f]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{2,}");

    public String normalize(String content) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        String text = isMarkup(content) ? htmlToText(content) : content;
        return tidy(text);
    }

    public boolean isMarkup(String content) {
        return content != null && MARKUP.matcher(content).find();
    }

    private String htmlToText(String html) {
        Document document = Jsoup.parse(html);
        StringBuilder text = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode) {
                    text.append(((TextNode) node).text());
                } else if (node instanceof Element && "br".equals(((Element) node).normalName())) {
                    text.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element && ((Element) node).isBlock()) {
                    text.append('\n');
                }
            }
        }, document.body());
        return text.toString();
    }

    private String tidy(String text) {
        String unified = text.replace("\r\n", "\n").replace('\r', '\n');
        StringBuilder out = new StringBuilder(unified.length());
        for (String line : unified.split("\n", -1)) {
            out.append(HORIZONTAL_SPACE.matcher(line).replaceAll(" ").trim()).append('\n');
        }
        return BLANK_LINES.matcher(out.toString()).replaceAll("\n").trim();
    }
}
