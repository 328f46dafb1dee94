package com.lazytext.config;

/**
 * 全局常量定义
 *
 * 包含存储格式魔数、文件后缀、流水线默认参数和CLI安全上限
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 存储格式 ====================
    /** 长度索引文件魔数 "LTLN" */
    public static final int LENGTHS_MAGIC = 0x4C544C4E;
    /** 长度索引文件格式版本号 */
    public static final short FORMAT_VERSION = 1;
    /** 长度索引文件后缀 */
    public static final String LENGTHS_SUFFIX = ".lengths.bin";
    /** 扁平 id 数组文件后缀 */
    public static final String MEMMAP_SUFFIX = ".memmap";
    /** 默认 id 位宽（字节） */
    public static final int DEFAULT_ID_WIDTH = 8;
    /** 单个映射分片字节数（1GB），必须是所有 id 位宽的整数倍 */
    public static final long MAP_CHUNK_BYTES = 1L << 30;
    /** 构建时写缓冲大小 */
    public static final int WRITE_BUFFER_BYTES = 64 * 1024;

    // ==================== 流水线参数 ====================
    /** max_length / read_n 的“不限制”取值 */
    public static final int UNBOUNDED = -1;
    /** 默认复用已有存储 */
    public static final boolean DEFAULT_REUSE = true;
    /** 默认每次送入分句器的行数 */
    public static final int DEFAULT_READ_N = 1;
    /** 字符级切分与子词切分的默认分隔符 */
    public static final String DEFAULT_SEPARATOR = "@@";

    // ==================== 词表 ====================
    /** 未登录词 */
    public static final String UNK_TOKEN = "<unk>";
    /** 填充符 */
    public static final String PAD_TOKEN = "<pad>";
    /** 句首符 */
    public static final String SOS_TOKEN = "<s>";
    /** 句尾符 */
    public static final String EOS_TOKEN = "</s>";
    /** 词表文件后缀 */
    public static final String VOCAB_SUFFIX = ".vocab.json";

    // ==================== CLI参数 ====================
    /** show 子命令单次最多输出的行数 */
    public static final int MAX_SHOW_LIMIT = 10_000;
}
