package com.lazytext.vocab;

/**
 * 词与整数 id 的双向映射，未登录词映射到保留的 unk id。
 */
public interface Vocabulary {

    /**
     * 返回词对应的 id，未登录词返回 {@link #unknownId()}。
     */
    int id(String token);

    /**
     * 返回 id 对应的词。
     *
     * @throws IndexOutOfBoundsException id 不在词表范围内
     */
    String token(int id);

    int unknownId();

    int size();
}
