/**
 * SemanticSummaryService.java
 *
 * 仅根据节点类型，从规范化语法树推导 SemanticSummary。
 * 分类是一张有序表：节点类型转为小写后依次与每个类别比较，
 * 第一个包含匹配关键字的类别胜出，每个节点最多归入一个类别。
 * 每个节点只访问一次，深度哨兵节点永远不会匹配。
 *
 * 这里只做结构分析而非语义分析：对于占位树，摘要反映的就是占位内容。
 */
package club.ppmc.transpiler.service;

import club.ppmc.transpiler.model.SemanticEntry;
import club.ppmc.transpiler.model.SemanticSummary;
import club.ppmc.transpiler.model.SyntaxNode;
import club.ppmc.transpiler.util.TextExcerpts;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class SemanticSummaryService {

    enum Category {
        TYPE(List.of("class")),
        CALLABLE(List.of("method", "function")),
        DATA(List.of("property", "field")),
        IMPORT(List.of("using_directive", "import"));

        private final List<String> keywords;

        Category(List<String> keywords) {
            this.keywords = keywords;
        }
    }

    private final SettingsService settingsService;

    public SemanticSummaryService(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    public SemanticSummary summarize(SyntaxNode root) {
        if (root == null) {
            return SemanticSummary.empty();
        }
        int nameLength = settingsService.getSettings().getSummaryNameLength();

        Map<Category, List<SemanticEntry>> found = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            found.put(category, new ArrayList<>());
        }

        // 迭代式先序遍历
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            Category category = classify(node.type());
            if (category != null) {
                found.get(category)
                        .add(new SemanticEntry(TextExcerpts.truncate(node.text(), nameLength), node.startLine()));
            }
            List<SyntaxNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }

        return new SemanticSummary(
                found.get(Category.TYPE),
                found.get(Category.CALLABLE),
                found.get(Category.DATA),
                found.get(Category.IMPORT));
    }

    /** 类型 {@code kind} 中包含其关键字的第一个类别，没有则为 null。 */
    static Category classify(String kind) {
        if (kind == null || SyntaxNode.MAX_DEPTH_REACHED.equals(kind)) {
            return null;
        }
        String lowered = kind.toLowerCase(Locale.ROOT);
        for (Category category : Category.values()) {
            for (String keyword : category.keywords) {
                if (lowered.contains(keyword)) {
                    return category;
                }
            }
        }
        return null;
    }
}
