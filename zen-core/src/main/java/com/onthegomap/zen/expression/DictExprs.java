package com.onthegomap.zen.expression;

import com.onthegomap.zen.datatype.Dict;
import com.onthegomap.zen.datatype.DictType;
import com.onthegomap.zen.util.Contract;

/** Argument checks shared by the dictionary node kinds. */
final class DictExprs {
  private DictExprs() {}

  static <K, V> void assertKey(String operation, Zen<Dict<K, V>> dict, Zen<K> key) {
    Contract.assertTrue(dict.type() instanceof DictType, "%s requires a dictionary, not %s", operation, dict.type());
    Contract.assertTrue(Zen.dictType(dict).keyType().equals(key.type()), "%s key of type %s does not match %s",
      operation, key.type(), dict.type());
  }
}
