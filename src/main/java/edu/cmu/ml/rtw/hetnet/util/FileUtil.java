package edu.cmu.ml.rtw.hetnet.util;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;

import com.google.common.collect.Maps;

/**
 * The boundary between this code and the file system.  Everything that reads or writes a table
 * goes through here, so tests can swap in a fake file system by overriding the reader and writer
 * methods.
 */
public class FileUtil {

  public FileWriter getFileWriter(String filename) throws IOException {
    return getFileWriter(filename, false);
  }

  public FileWriter getFileWriter(String filename, boolean append) throws IOException {
    return new FileWriter(filename, append);
  }

  /**
   * Opens filename for reading.  Files ending in .bz2 are decompressed on the fly.
   */
  public BufferedReader getBufferedReader(String filename) throws IOException {
    if (filename.endsWith(".bz2")) {
      return getBZ2BufferedReader(filename);
    }
    return new BufferedReader(new FileReader(filename));
  }

  public BufferedReader getBZ2BufferedReader(String filename) throws IOException {
    return new BufferedReader(new InputStreamReader(
        new BZip2CompressorInputStream(new FileInputStream(filename)), StandardCharsets.UTF_8));
  }

  public void mkdirs(String dirName) {
    new File(dirName).mkdirs();
  }

  public String addDirectorySeparatorIfNecessary(String dirName) {
    if (dirName.endsWith(File.separator)) return dirName;
    return dirName + File.separator;
  }

  public Map<String, String> readMapFromTsvReader(BufferedReader reader) throws IOException {
    Map<String, String> map = Maps.newLinkedHashMap();
    String line;
    while ((line = reader.readLine()) != null) {
      if (line.trim().isEmpty() || line.startsWith("#")) continue;
      String[] fields = line.split("\t");
      if (fields.length != 2) {
        reader.close();
        throw new IllegalArgumentException(
            "Expected two tab-separated columns, but saw: " + line);
      }
      map.put(fields[0].trim(), fields[1].trim());
    }
    reader.close();
    return map;
  }
}
