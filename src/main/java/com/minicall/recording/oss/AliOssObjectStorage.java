package com.minicall.recording.oss;

import com.aliyun.oss.ClientException;
import com.aliyun.oss.OSS;
import com.aliyun.oss.OSSClientBuilder;
import com.aliyun.oss.OSSException;
import com.aliyun.oss.model.ObjectMetadata;
import com.aliyun.oss.model.PutObjectRequest;
import com.minicall.common.error.RemoteServiceException;
import com.minicall.recording.ObjectStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.util.Map;

/**
 * 录制文件上传到阿里云 OSS。每次上传新建客户端，用完即关。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AliOssObjectStorage implements ObjectStorage {

    private static final String SERVICE = "oss";

    private final OssProperties props;

    @Override
    public String put(String key, byte[] bytes, String contentType, Map<String, String> metadata) {
        if (!props.configured()) {
            throw new RemoteServiceException(SERVICE, "object storage is not configured");
        }
        ObjectMetadata meta = new ObjectMetadata();
        meta.setContentType(contentType);
        meta.setContentLength(bytes.length);
        if (metadata != null) {
            meta.setUserMetadata(metadata);
        }

        OSS client = newClient();
        try {
            client.putObject(new PutObjectRequest(props.bucket(), key, new ByteArrayInputStream(bytes), meta));
        } catch (OSSException oe) {
            log.error("oss put failed: key={}, code={}, requestId={}, msg={}",
                    key, oe.getErrorCode(), oe.getRequestId(), oe.getErrorMessage());
            throw new RemoteServiceException(SERVICE, "upload failed: " + oe.getErrorMessage(), oe);
        } catch (ClientException ce) {
            log.error("oss client error: key={}, msg={}", key, ce.getMessage());
            throw new RemoteServiceException(SERVICE, "client error: " + ce.getMessage(), ce);
        } finally {
            client.shutdown();
        }

        String url = props.objectUrl(key);
        log.info("oss object uploaded: key={}, bytes={}, url={}", key, bytes.length, url);
        return url;
    }

    OSS newClient() {
        return new OSSClientBuilder().build(props.endpoint(), props.accessKeyId(), props.accessKeySecret());
    }
}
