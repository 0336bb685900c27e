package com.flagship.account_storage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AccountStorageApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccountStorageApplication.class, args);
    }
}
