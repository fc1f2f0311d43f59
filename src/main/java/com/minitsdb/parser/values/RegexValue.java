package com.minitsdb.parser.values;

import com.minitsdb.parser.Value;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * RegexValue - 正则表达式
 *
 * 用在FROM子句中表示一组表(正则表),或者用在 =~ / !~ 的右侧:
 * - FROM /.*cpu.*&#47;
 * - WHERE host =~ /srv[0-9]+/i
 *
 * 正则在构造时编译一次,之后只读,可以被多个线程共享。
 */
public class RegexValue implements Value {

    /** 原始正则文本(不含两侧的/) */
    private final String regex;

    /** 是否忽略大小写(/.../i) */
    private final boolean caseInsensitive;

    private final Pattern compiledRegex;

    public RegexValue(String regex) {
        this(regex, false);
    }

    public RegexValue(String regex, boolean caseInsensitive) {
        this.regex = Objects.requireNonNull(regex, "regex cannot be null");
        this.caseInsensitive = caseInsensitive;
        try {
            this.compiledRegex = caseInsensitive
                    ? Pattern.compile(regex, Pattern.CASE_INSENSITIVE)
                    : Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid regex: " + regex, e);
        }
    }

    @Override
    public String getName() {
        return regex;
    }

    @Override
    public Optional<Pattern> getCompiledRegex() {
        return Optional.of(compiledRegex);
    }

    @Override
    public ValueType getType() {
        return ValueType.REGEX;
    }

    @Override
    public String toString() {
        return "/" + regex + "/" + (caseInsensitive ? "i" : "");
    }
}
