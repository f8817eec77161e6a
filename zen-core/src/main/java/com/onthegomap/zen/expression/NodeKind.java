package com.onthegomap.zen.expression;

/**
 * Tag for each concrete kind of {@link Zen} node. There is exactly one constant per permitted subclass of {@link Zen}
 * and one visit method per constant on {@link ZenExprVisitor}.
 */
public enum NodeKind {
  CONSTANT,
  ARBITRARY,
  PARAMETER,
  LOGICAL_BINOP,
  NOT,
  IF,
  ARITH_BINOP,
  ARITH_COMPARISON,
  BITWISE_NOT,
  BITWISE_BINOP,
  EQUALITY,
  CAST,
  GET_FIELD,
  WITH_FIELD,
  CREATE_OBJECT,
  SEQ_UNIT,
  SEQ_CONCAT,
  SEQ_LENGTH,
  SEQ_AT,
  SEQ_NTH,
  SEQ_CONTAINS,
  SEQ_INDEX_OF,
  SEQ_SLICE,
  SEQ_REPLACE_FIRST,
  DICT_SET,
  DICT_DELETE,
  DICT_GET,
  DICT_COMBINE,
  CMAP_SET,
  CMAP_GET,
  FSEQ_ADD_FRONT,
  FSEQ_CASE,
  APPLY
}
