/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.phylodist.readers;

import io.phylodist.core.InputFormatException;
import io.phylodist.core.tree.PhyloTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/// Reads a rooted tree in Newick notation.
///
/// Supported syntax:
/// - nested groups {@code (a,b,(c,d)e)f;} with labels on tips and internal nodes
/// - branch lengths after {@code :}, in decimal or scientific notation; other number forms
///   such as {@code Infinity}, {@code NaN} or hexadecimal are rejected
/// - single-quoted labels, with {@code ''} standing for a literal quote
/// - bracketed comments {@code [...]}, which are skipped wherever whitespace is allowed
/// - whitespace and line breaks between tokens
///
/// Unquoted underscores are kept as they are. Only the first tree of the input is read;
/// anything after its terminating {@code ;} is ignored. The {@code ;} itself may be omitted
/// at the very end of the input.
///
/// The parser keeps open groups on an explicit stack, so nesting depth is limited by memory
/// only.
public final class NewickTreeReader {
    private static final Logger logger = LogManager.getLogger(NewickTreeReader.class);

    // Plain decimal or scientific notation; no Infinity, NaN, hex or type suffixes
    private static final Pattern BRANCH_LENGTH =
        Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final CharSequence text;
    private final Path source;
    private final PhyloTree.Builder builder = PhyloTree.builder();
    private int pos;

    private NewickTreeReader(CharSequence text, Path source) {
        this.text = text;
        this.source = source;
    }

    /// Reads the first tree from a file.
    ///
    /// @param path a Newick file
    /// @return the parsed tree
    /// @throws InputFormatException if the file cannot be read or is not valid Newick
    public static PhyloTree read(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InputFormatException(path, "Unable to read tree file: " + e.getMessage(), e);
        }
        PhyloTree tree = new NewickTreeReader(content, path).parse();
        logger.info("Read tree from {}: {} nodes, {} tips", path, tree.size(), tree.tips().length);
        return tree;
    }

    /// Parses the first tree of a Newick string.
    ///
    /// @param newick Newick text
    /// @return the parsed tree
    /// @throws InputFormatException if the text is not valid Newick
    public static PhyloTree parse(CharSequence newick) {
        return new NewickTreeReader(newick, null).parse();
    }

    private PhyloTree parse() {
        Deque<Integer> open = new ArrayDeque<>();
        boolean expectNode = true;
        boolean rootCreated = false;

        skipIgnorable();
        if (pos >= text.length()) {
            throw error("Empty tree");
        }

        while (true) {
            skipIgnorable();
            if (pos >= text.length()) {
                if (expectNode || !open.isEmpty()) {
                    throw error("Unexpected end of input, " + open.size() + " unclosed group(s)");
                }
                break;
            }
            char c = text.charAt(pos);
            if (expectNode) {
                if (c == '(') {
                    int node = newNode(open, rootCreated);
                    rootCreated = true;
                    open.push(node);
                    pos++;
                } else if (c == ')' && !open.isEmpty() || c == ',') {
                    // empty tip such as "(,A)" or "(A,)"
                    int node = newNode(open, rootCreated);
                    rootCreated = true;
                    expectNode = false;
                    readLength(node);
                } else if (c == ';' || c == ')') {
                    throw error("Unexpected '" + c + "'");
                } else {
                    int node = newNode(open, rootCreated);
                    rootCreated = true;
                    builder.name(node, readLabel());
                    readLength(node);
                    expectNode = false;
                }
            } else {
                if (c == ',') {
                    if (open.isEmpty()) {
                        throw error("',' outside of any group");
                    }
                    pos++;
                    expectNode = true;
                } else if (c == ')') {
                    if (open.isEmpty()) {
                        throw error("Unbalanced ')'");
                    }
                    int node = open.pop();
                    pos++;
                    skipIgnorable();
                    builder.name(node, readLabel());
                    readLength(node);
                } else if (c == ';') {
                    if (!open.isEmpty()) {
                        throw error("';' before " + open.size() + " group(s) were closed");
                    }
                    pos++;
                    break;
                } else {
                    throw error("Unexpected '" + c + "'");
                }
            }
        }
        return builder.build();
    }

    private int newNode(Deque<Integer> open, boolean rootCreated) {
        if (open.isEmpty()) {
            if (rootCreated) {
                throw error("More than one root; missing ',' or '('");
            }
            return builder.addRoot();
        }
        return builder.addChild(open.peek());
    }

    private String readLabel() {
        if (pos < text.length() && text.charAt(pos) == '\'') {
            return readQuotedLabel();
        }
        int start = pos;
        while (pos < text.length() && !isDelimiter(text.charAt(pos))) {
            pos++;
        }
        return text.subSequence(start, pos).toString();
    }

    private String readQuotedLabel() {
        int start = pos;
        pos++;
        StringBuilder label = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\'') {
                if (pos + 1 < text.length() && text.charAt(pos + 1) == '\'') {
                    label.append('\'');
                    pos += 2;
                    continue;
                }
                pos++;
                return label.toString();
            }
            label.append(c);
            pos++;
        }
        pos = start;
        throw error("Unterminated quoted label");
    }

    private void readLength(int node) {
        skipIgnorable();
        if (pos >= text.length() || text.charAt(pos) != ':') {
            return;
        }
        pos++;
        skipIgnorable();
        int start = pos;
        while (pos < text.length() && !isDelimiter(text.charAt(pos))) {
            pos++;
        }
        String token = text.subSequence(start, pos).toString();
        if (!BRANCH_LENGTH.matcher(token).matches()) {
            pos = start;
            throw error("Invalid branch length '" + token + "'");
        }
        double length = Double.parseDouble(token);
        if (!Double.isFinite(length)) {
            pos = start;
            throw error("Branch length out of range '" + token + "'");
        }
        builder.parentEdge(node, length);
    }

    private void skipIgnorable() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '[') {
                int start = pos;
                while (pos < text.length() && text.charAt(pos) != ']') {
                    pos++;
                }
                if (pos >= text.length()) {
                    pos = start;
                    throw error("Unterminated comment");
                }
                pos++;
            } else {
                return;
            }
        }
    }

    private static boolean isDelimiter(char c) {
        return c == '(' || c == ')' || c == ',' || c == ':' || c == ';' || c == '[' || Character.isWhitespace(c);
    }

    private InputFormatException error(String message) {
        return new InputFormatException(source, message + " at offset " + pos);
    }
}
