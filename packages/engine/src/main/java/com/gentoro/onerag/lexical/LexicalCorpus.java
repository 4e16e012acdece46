package com.gentoro.onerag.lexical;

import java.util.List;

/** Authoritative source of chunk texts for building a lexical index of one scope. */
public interface LexicalCorpus {
  List<CorpusChunk> listChunkTextsByScope(String scope);
}
