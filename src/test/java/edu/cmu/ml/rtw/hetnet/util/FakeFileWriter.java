package edu.cmu.ml.rtw.hetnet.util;

import java.io.FileWriter;
import java.io.IOException;
import java.util.List;

import junit.framework.TestCase;

import com.google.common.collect.Lists;

public class FakeFileWriter extends FileWriter {

  private List<String> written;
  private String filename;
  private boolean isClosed = false;

  public FakeFileWriter(String filename) throws IOException {
    super("/dev/null");
    this.filename = filename;
    written = Lists.newArrayList();
  }

  @Override
  public void write(String line) {
    written.add(line);
  }

  @Override
  public void write(String str, int off, int len) {
    written.add(str.substring(off, off + len));
  }

  @Override
  public void write(char[] cbuf, int off, int len) {
    written.add(new String(cbuf, off, len));
  }

  @Override
  public void write(int c) {
    written.add(String.valueOf((char) c));
  }

  @Override
  public void close() throws IOException {
    super.close();
    isClosed = true;
  }

  public boolean isClosed() {
    return isClosed;
  }

  public String getContents() {
    StringBuilder builder = new StringBuilder();
    for (String line : written) {
      builder.append(line);
    }
    return builder.toString();
  }

  public void expectWritten(String expected) {
    TestCase.assertTrue("File " + filename + " not closed", isClosed);
    TestCase.assertEquals("File: " + filename, expected, getContents());
    written = Lists.newArrayList();
  }
}
