package com.mk.fx.qa.jmeter.execution.resource;

import com.mk.fx.qa.jmeter.execution.exception.StorageException;
import java.io.IOException;
import org.springframework.web.multipart.MultipartFile;

final class Uploads {

  private Uploads() {}

  static byte[] bytes(MultipartFile file) {
    try {
      return file.getBytes();
    } catch (IOException e) {
      throw new StorageException("Failed to read uploaded file " + file.getOriginalFilename(), e);
    }
  }
}
