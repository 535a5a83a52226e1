package site.rstream.core;

import site.rstream.database.RedisDB;
import site.rstream.datastructure.RedisBytes;
import site.rstream.datastructure.RedisData;
import site.rstream.datastructure.StreamEntry;
import site.rstream.datastructure.StreamEntryId;
import site.rstream.utils.GlobPattern;

import java.util.List;
import java.util.Map;

/**
 * 数据引擎接口，所有值和过期表的唯一所有者。
 *
 * <p>每个操作相对单线程事件循环是原子的。带过期检查的读取会先删除已过期的键。
 */
public interface RedisCore {

    RedisData get(RedisBytes key);

    /**
     * @param ttlMillis 相对过期时间，小于0表示不过期
     */
    void set(RedisBytes key, RedisData value, long ttlMillis);

    /**
     * 写入带绝对过期时间的值，快照加载时使用
     */
    void setWithDeadline(RedisBytes key, RedisData value, long expireAtMs);

    boolean exists(RedisBytes key);

    boolean delete(RedisBytes key);

    /**
     * @return 匹配的键，按字典序排序
     */
    List<RedisBytes> keys(GlobPattern pattern);

    /**
     * @return "string"、"stream" 或 "none"
     */
    String typeOf(RedisBytes key);

    /**
     * 对字符串值加一，键不存在时视为0
     *
     * @return 新值
     */
    long incr(RedisBytes key);

    /**
     * 追加流条目，流不存在时创建
     *
     * @return 分配的ID
     */
    StreamEntryId xadd(RedisBytes key, String idSpec, List<RedisBytes> fieldsAndValues);

    /**
     * @param count 最多返回条数，负数表示不限制
     */
    List<StreamEntry> xrange(RedisBytes key, StreamEntryId start, StreamEntryId end, int count);

    /**
     * 对每个 (key, afterId) 读取ID大于afterId的条目
     *
     * <p>指定count时所有流的结果合并后按ID全局排序截断，再按键的原始顺序分组。
     * 不存在或没有新条目的流不出现在结果中。
     *
     * @param count 最多返回条数，负数表示不限制
     * @return 键到条目列表的有序映射
     */
    Map<RedisBytes, List<StreamEntry>> xread(List<RedisBytes> keys, List<StreamEntryId> afterIds, int count);

    /**
     * @return 流的最后一个ID，流不存在时返回 0-0
     */
    StreamEntryId lastStreamId(RedisBytes key);

    /**
     * @return 自启动以来的写操作次数，供快照策略使用
     */
    long getDirty();

    long currentTimeMillis();

    RedisDB getDatabase();

    void flushAll();
}
