package com.minitsdb.parser.values;

import com.minitsdb.CommonConstant;
import com.minitsdb.parser.Value;

/**
 * WildcardValue - 通配符 *
 *
 * 出现在投影列表中表示所有列,出现在函数参数中(如count(*))不算投影通配符。
 */
public class WildcardValue implements Value {

    @Override
    public String getName() {
        return CommonConstant.WILDCARD;
    }

    @Override
    public ValueType getType() {
        return ValueType.WILDCARD;
    }

    @Override
    public String toString() {
        return CommonConstant.WILDCARD;
    }
}
