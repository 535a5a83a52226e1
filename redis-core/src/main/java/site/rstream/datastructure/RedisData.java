package site.rstream.datastructure;

/**
 * 键对应的值，字符串或流。
 */
public interface RedisData {

    /**
     * @return TYPE 命令返回的类型名
     */
    String getTypeName();
}
