/**
 * SourceParserService.java
 *
 * tree-sitter C# 语法的适配器。C# 是唯一有真实语法的方言：
 * VB6 和 VB.NET 总是返回 GRAMMAR_UNAVAILABLE，这是固有限制而不是错误。
 * 本地库在首次使用时才加载；如果无法加载，C# 也会被报告为没有语法。
 * 本地解析器抛出的任何异常都不会逃出这个类，
 * 故障会以 FAILED 结果报告。
 *
 * TSParser 实例不是线程安全的，因此每个请求线程都有自己的实例。
 */
package club.ppmc.transpiler.service;

import club.ppmc.transpiler.model.Dialect;
import club.ppmc.transpiler.model.ParseOutcome;
import club.ppmc.transpiler.model.ParseTreeNode;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterCSharp;

@Service
@Slf4j
public class SourceParserService {

    private volatile TSLanguage csharpLanguage;
    private volatile boolean grammarLoadAttempted;

    private final ThreadLocal<TSParser> parserCache =
            ThreadLocal.withInitial(
                    () -> {
                        var parser = new TSParser();
                        parser.setLanguage(csharpLanguage);
                        return parser;
                    });

    /**
     * 解析声明为 {@code languageTag} 的 {@code code}。
     *
     * @return 成功时返回带原生根节点的 PARSED；没有语法的方言（或本地语法无法加载时）
     *     返回 GRAMMAR_UNAVAILABLE；解析器出现任何故障时返回 FAILED。
     */
    public ParseOutcome parse(String code, String languageTag) {
        Dialect dialect = Dialect.fromTag(languageTag).orElse(null);
        if (dialect != Dialect.CSHARP) {
            return ParseOutcome.grammarUnavailable("No grammar available for dialect '" + languageTag + "'");
        }
        if (!isGrammarLoaded()) {
            return ParseOutcome.grammarUnavailable("C# grammar could not be loaded");
        }
        try {
            String source = code == null ? "" : code;
            TSTree tree = Objects.requireNonNull(parserCache.get().parseString(null, source), "parser returned no tree");
            TSNode root = tree.getRootNode();
            if (root == null || root.isNull()) {
                return ParseOutcome.failed("Parser produced an empty tree");
            }
            return ParseOutcome.parsed(new TreeSitterNode(tree, root, source.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception | LinkageError e) {
            log.error("解析 {} 代码出错: {}", dialect.label(), e.getMessage(), e);
            return ParseOutcome.failed("Parser error: " + e.getMessage());
        }
    }

    /** 在当前进程中解析 {@code dialect} 是否使用真实语法。 */
    public boolean hasGrammar(Dialect dialect) {
        return dialect == Dialect.CSHARP && isGrammarLoaded();
    }

    boolean isGrammarLoaded() {
        if (!grammarLoadAttempted) {
            synchronized (this) {
                if (!grammarLoadAttempted) {
                    try {
                        csharpLanguage = new TreeSitterCSharp();
                        log.info("C# 解析器加载成功。");
                    } catch (Exception | LinkageError e) {
                        log.warn("C# 解析器不可用: {}", e.toString());
                        csharpLanguage = null;
                    }
                    grammarLoadAttempted = true;
                }
            }
        }
        return csharpLanguage != null;
    }

    /**
     * tree-sitter 节点的 ParseTreeNode 视图。它持有所属的语法树，
     * 保证使用视图期间本地内存不会被释放。
     */
    private static final class TreeSitterNode implements ParseTreeNode {

        private final TSTree tree;
        private final TSNode node;
        private final byte[] source;

        TreeSitterNode(TSTree tree, TSNode node, byte[] source) {
            this.tree = tree;
            this.node = node;
            this.source = source;
        }

        @Override
        public String type() {
            return node.getType();
        }

        @Override
        public int startLine() {
            return node.getStartPoint().getRow();
        }

        @Override
        public int endLine() {
            return node.getEndPoint().getRow();
        }

        @Override
        public String text() {
            int start = Math.max(0, Math.min(node.getStartByte(), source.length));
            int end = Math.max(start, Math.min(node.getEndByte(), source.length));
            return new String(source, start, end - start, StandardCharsets.UTF_8);
        }

        @Override
        public int childCount() {
            return node.getChildCount();
        }

        @Override
        public ParseTreeNode child(int index) {
            return new TreeSitterNode(tree, node.getChild(index), source);
        }

        @Override
        public boolean isMissing() {
            return node.isMissing();
        }
    }
}
