package edu.cmu.ml.rtw.hetnet.util;

import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;

public class MapUtil {

  public static <K, V> V getWithDefault(Map<K, V> map, K key, V defaultValue) {
    V value = map.get(key);
    if (value == null) {
      return defaultValue;
    }
    return value;
  }

  /**
   * Adds value to the list corresponding to key in the map.  If the key does not already have a
   * list, we instantiate an ArrayList.
   */
  public static <K, V> void addValueToKeyList(Map<K, List<V>> map, K key, V value) {
    List<V> list = map.get(key);
    if (list == null) {
      list = Lists.newArrayList();
      map.put(key, list);
    }
    list.add(value);
  }
}
